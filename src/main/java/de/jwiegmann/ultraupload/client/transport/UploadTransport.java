package de.jwiegmann.ultraupload.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Überträgt eine Datei an einen Endpunkt, mit begrenzter Wiederholung und exponentiellem Backoff.
 *
 * <p>Wiederholt werden 5xx, 429, 408 und Netzwerkfehler. Andere Status sind endgültig.
 * Versuche einer Datei laufen strikt nacheinander. Der Transport verändert keinen
 * geteilten Zustand, das Ergebnis wendet der Aufrufer an.</p>
 */
@Slf4j(topic = "ultra.upload")
public class UploadTransport {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final UploadHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int maxRetries;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    public UploadTransport(UploadHttpClient httpClient, ObjectMapper objectMapper) {
        this(httpClient, objectMapper, DEFAULT_MAX_RETRIES, new BackoffPolicy(), Sleeper.THREAD);
    }

    /**
     * @param maxRetries Gesamtzahl der Versuche inklusive des ersten, mindestens 1
     */
    public UploadTransport(UploadHttpClient httpClient, ObjectMapper objectMapper, int maxRetries,
                           BackoffPolicy backoffPolicy, Sleeper sleeper) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, was " + maxRetries);
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.maxRetries = maxRetries;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
    }

    public TransportResult send(String endpoint, UploadPayload payload) {
        return send(endpoint, payload, CancellationToken.NONE);
    }

    public TransportResult send(String endpoint, UploadPayload payload, CancellationToken cancellation) {
        return send(endpoint, payload, cancellation, 1);
    }

    /**
     * @param attempt Nummer des ersten Versuchs, normalerweise 1
     * @throws IllegalArgumentException wenn {@code attempt} außerhalb von 1..maxRetries liegt
     */
    public TransportResult send(String endpoint, UploadPayload payload, CancellationToken cancellation, int attempt) {
        if (attempt < 1 || attempt > maxRetries) {
            throw new IllegalArgumentException(
                    "attempt must be between 1 and " + maxRetries + ", was " + attempt);
        }
        int current = attempt;
        UploadError lastError = null;
        HttpUploadResponse lastResponse = null;

        while (current <= maxRetries) {
            if (cancellation.isCancelled()) {
                return TransportResult.failure(UploadErrors.cancelled(), lastResponse, current - 1);
            }

            boolean retryable;
            try {
                HttpUploadResponse response = httpClient.post(endpoint, payload);
                lastResponse = response;
                if (cancellation.isCancelled()) {
                    // Antwort eines bereits abgebrochenen Uploads wird verworfen
                    return TransportResult.failure(UploadErrors.cancelled(), response, current);
                }
                if (response.isSuccessful()) {
                    return TransportResult.success(response, current);
                }
                lastError = parseError(response);
                retryable = BackoffPolicy.isRetryable(response.getStatus());
                log.warn("Upload of {} to {} failed with HTTP {} (attempt {}/{})",
                        payload.getFileName(), endpoint, response.getStatus(), current, maxRetries);
            } catch (IOException e) {
                lastError = UploadErrors.networkError(e.getMessage());
                retryable = true;
                log.warn("Network error uploading {} to {} (attempt {}/{}): {}",
                        payload.getFileName(), endpoint, current, maxRetries, e.getMessage());
            }

            if (!retryable || current == maxRetries) {
                return TransportResult.failure(lastError, lastResponse, current);
            }

            try {
                sleeper.sleep(backoffPolicy.delayBeforeAttempt(current + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TransportResult.failure(UploadErrors.cancelled(), lastResponse, current);
            }
            current++;
        }
        throw new IllegalStateException("Retry loop left without result for " + payload.getFileName());
    }

    UploadError parseError(HttpUploadResponse response) {
        if (!response.isJson()) {
            return UploadErrors.unexpectedResponse(response.getBody());
        }
        try {
            return objectMapper.readValue(response.getBody(), UploadError.class);
        } catch (JsonProcessingException e) {
            return UploadErrors.unexpectedResponse(response.getBody());
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
