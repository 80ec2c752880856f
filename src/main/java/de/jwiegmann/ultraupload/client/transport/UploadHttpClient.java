package de.jwiegmann.ultraupload.client.transport;

import java.io.IOException;

/**
 * Ein einzelner Multipart-POST. Jeder HTTP-Status ist eine Antwort;
 * nur Netzwerkfehler und Timeouts werfen.
 */
public interface UploadHttpClient {

    HttpUploadResponse post(String endpoint, UploadPayload payload) throws IOException;
}
