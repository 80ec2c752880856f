package de.jwiegmann.ultraupload.client.transport;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link UploadHttpClient} auf Basis von Spring {@link RestClient}.
 * Timeouts kommen aus der RequestFactory des übergebenen Clients.
 */
public class RestClientUploadHttpClient implements UploadHttpClient {

    static final String CSRF_HEADER = "X-CSRF-TOKEN";

    private final RestClient restClient;

    public RestClientUploadHttpClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public HttpUploadResponse post(String endpoint, UploadPayload payload) throws IOException {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(payload.getContent()))
                .filename(payload.getFileName())
                .contentType(mediaTypeOf(payload.getMimeType()));
        if (payload.getCsrfToken() != null) {
            body.part("_token", payload.getCsrfToken());
        }
        if (payload.getUploadType() != null) {
            body.part("uploadType", payload.getUploadType());
        }
        for (Map.Entry<String, String> field : payload.getFields().entrySet()) {
            body.part(field.getKey(), field.getValue());
        }

        try {
            return restClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (payload.getCsrfToken() != null) {
                            headers.set(CSRF_HEADER, payload.getCsrfToken());
                        }
                    })
                    .body(body.build())
                    .exchange((request, response) -> {
                        MediaType contentType = response.getHeaders().getContentType();
                        String text = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        return new HttpUploadResponse(
                                response.getStatusCode().value(),
                                contentType == null ? null : contentType.toString(),
                                text);
                    });
        } catch (ResourceAccessException e) {
            throw new IOException("Upload request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private static MediaType mediaTypeOf(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (IllegalArgumentException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
