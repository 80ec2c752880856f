package de.jwiegmann.ultraupload.client;

/**
 * Rückmeldungen an die Oberfläche. Aufrufe können aus beliebigen Threads kommen.
 */
public interface UploadStatusListener {

    UploadStatusListener NONE = new UploadStatusListener() {
    };

    default void onTaskStateChanged(UploadTask task, UploadTaskState from, UploadTaskState to) {
    }

    default void onStatus(String message, StatusKind kind) {
    }

    default void onProgress(UploadProgress progress) {
    }
}
