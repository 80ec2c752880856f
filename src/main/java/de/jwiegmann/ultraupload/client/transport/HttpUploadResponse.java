package de.jwiegmann.ultraupload.client.transport;

import lombok.Value;

@Value
public class HttpUploadResponse {
    int status;
    String contentType;
    String body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isJson() {
        return contentType != null && contentType.contains("json");
    }
}
