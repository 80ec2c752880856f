package de.jwiegmann.ultraupload.client.transport;

/**
 * Vom Client erzeugte Fehlerbeschreibungen.
 */
public final class UploadErrors {

    public static final String UNEXPECTED_RESPONSE = "unexpected_response";
    public static final String FETCH_ERROR = "fetch_error";
    public static final String INVALID_TOKEN = "invalid_token";
    public static final String CANCELLED = "cancelled";
    public static final String HANDLER_ERROR = "handler_error";

    private UploadErrors() {
    }

    public static UploadError unexpectedResponse(String rawBody) {
        return UploadError.builder()
                .message("Error processing the upload")
                .details(rawBody)
                .state("unknown")
                .errorCode(UNEXPECTED_RESPONSE)
                .blocking("blocking")
                .build();
    }

    public static UploadError networkError(String details) {
        return UploadError.builder()
                .message("Error during upload request")
                .details(details)
                .state("network")
                .errorCode(FETCH_ERROR)
                .blocking("blocking")
                .build();
    }

    public static UploadError invalidToken() {
        return UploadError.builder()
                .message("Error: invalid verification token.")
                .errorCode(INVALID_TOKEN)
                .build();
    }

    public static UploadError cancelled() {
        return UploadError.builder()
                .message("Upload cancelled")
                .state("cancelled")
                .errorCode(CANCELLED)
                .blocking("not")
                .build();
    }

    public static UploadError handlerError(String details) {
        return UploadError.builder()
                .message("Error in upload handler")
                .details(details)
                .state("handler")
                .errorCode(HANDLER_ERROR)
                .blocking("blocking")
                .build();
    }
}
