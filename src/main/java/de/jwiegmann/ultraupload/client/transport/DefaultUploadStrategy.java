package de.jwiegmann.ultraupload.client.transport;

public class DefaultUploadStrategy implements UploadTypeStrategy {

    @Override
    public TransportResult upload(UploadTransport transport, String endpoint, UploadPayload payload,
                                  CancellationToken cancellation) {
        return transport.send(endpoint, payload, cancellation);
    }
}
