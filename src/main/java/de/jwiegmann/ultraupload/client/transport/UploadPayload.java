package de.jwiegmann.ultraupload.client.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Inhalt eines Upload-Requests: Datei plus Formularfelder.
 */
@Value
@Builder(toBuilder = true)
public class UploadPayload {
    String fileName;
    String mimeType;
    byte[] content;
    String uploadType;
    String csrfToken;
    @Singular
    Map<String, String> fields;
}
