package de.jwiegmann.ultraupload.client.transport;

import lombok.Value;

/**
 * Ausgang eines Transports: Erfolg, letzte Antwort (falls vorhanden) und Anzahl der Versuche.
 */
@Value
public class TransportResult {
    UploadError error;
    HttpUploadResponse response;
    boolean success;
    int attempts;

    public static TransportResult success(HttpUploadResponse response, int attempts) {
        return new TransportResult(null, response, true, attempts);
    }

    public static TransportResult failure(UploadError error, HttpUploadResponse response, int attempts) {
        return new TransportResult(error, response, false, attempts);
    }

    public boolean isCancelled() {
        return error != null && UploadErrors.CANCELLED.equals(error.getErrorCode());
    }
}
