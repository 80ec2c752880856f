package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.client.transport.UploadError;
import de.jwiegmann.ultraupload.control.validation.FileCandidate;
import lombok.Getter;

import java.util.UUID;

/**
 * Eine zum Upload vorgemerkte Datei. Zustand, Versuchszähler und letzter Fehler
 * werden nur über die synchronisierten Methoden geändert.
 */
@Getter
public class UploadTask {

    private final String id;
    private final String fileName;
    private final String mimeType;
    private final byte[] content;
    private final String uploadType;

    private UploadTaskState state = UploadTaskState.QUEUED;
    private int attempts;
    private UploadError lastError;
    private String serverMessage;

    public UploadTask(String fileName, String mimeType, byte[] content, String uploadType) {
        this(UUID.randomUUID().toString(), fileName, mimeType, content, uploadType);
    }

    public UploadTask(String id, String fileName, String mimeType, byte[] content, String uploadType) {
        this.id = id;
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.content = content;
        this.uploadType = uploadType;
    }

    public FileCandidate toCandidate() {
        return new FileCandidate(fileName, mimeType, content.length);
    }

    public synchronized UploadTaskState getState() {
        return state;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized UploadError getLastError() {
        return lastError;
    }

    public synchronized String getServerMessage() {
        return serverMessage;
    }

    /**
     * @return false, wenn der Übergang rückwärts ginge oder die Aufgabe schon abgeschlossen ist
     */
    synchronized boolean transitionTo(UploadTaskState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        state = next;
        return true;
    }

    synchronized void recordAttempts(int count, int maxRetries) {
        if (count > maxRetries) {
            throw new IllegalStateException("Attempt count " + count + " exceeds max retries " + maxRetries);
        }
        attempts = count;
    }

    synchronized void recordError(UploadError error) {
        lastError = error;
    }

    synchronized void recordServerMessage(String message) {
        serverMessage = message;
    }

    @Override
    public String toString() {
        return "UploadTask{" + fileName + ", " + getState() + ", attempts=" + getAttempts() + "}";
    }
}
