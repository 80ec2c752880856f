package de.jwiegmann.ultraupload.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Base64;

/**
 * EPP-Uploads: Inhalt vor dem Senden Base64-kodieren, danach das Verifikationstoken prüfen.
 */
@Slf4j(topic = "ultra.upload")
public class EppUploadStrategy implements UploadTypeStrategy {

    public static final String UPLOAD_TYPE = "epp";
    public static final String VALID_TOKEN = "VALID";

    @Override
    public TransportResult upload(UploadTransport transport, String endpoint, UploadPayload payload,
                                  CancellationToken cancellation) {
        UploadPayload encoded = payload.toBuilder()
                .content(Base64.getEncoder().encode(payload.getContent()))
                .uploadType(UPLOAD_TYPE)
                .build();

        TransportResult result = transport.send(endpoint, encoded, cancellation);
        if (!result.isSuccess()) {
            log.info("EPP upload of {} failed: {}", payload.getFileName(), result.getError());
            return result;
        }

        if (!hasValidToken(transport, result.getResponse())) {
            log.warn("EPP upload of {} returned no valid verification token", payload.getFileName());
            return TransportResult.failure(UploadErrors.invalidToken(), result.getResponse(), result.getAttempts());
        }
        log.info("EPP upload of {} verified", payload.getFileName());
        return result;
    }

    private static boolean hasValidToken(UploadTransport transport, HttpUploadResponse response) {
        if (response == null || response.getBody() == null || response.getBody().isBlank()) {
            return false;
        }
        try {
            JsonNode node = transport.getObjectMapper().readTree(response.getBody());
            return VALID_TOKEN.equals(node.path("verificationToken").asText(null));
        } catch (IOException e) {
            return false;
        }
    }
}
