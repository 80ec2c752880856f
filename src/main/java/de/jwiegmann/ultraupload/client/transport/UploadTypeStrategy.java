package de.jwiegmann.ultraupload.client.transport;

/**
 * Vor- und Nachbearbeitung eines Upload-Typs rund um den generischen Transport.
 */
public interface UploadTypeStrategy {

    TransportResult upload(UploadTransport transport, String endpoint, UploadPayload payload,
                           CancellationToken cancellation);
}
