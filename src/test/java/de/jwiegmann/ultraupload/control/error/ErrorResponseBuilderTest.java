package de.jwiegmann.ultraupload.control.error;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorResponseBuilderTest {

    private final ErrorResponseBuilder builder = new ErrorResponseBuilder();

    private static ErrorInfo info(BlockingLevel blocking, int status) {
        return ErrorInfo.builder()
                .errorCode("VIRUS_FOUND")
                .type(ErrorType.ERROR)
                .blocking(blocking)
                .message("Virus found in upload")
                .userMessage("The file contains a virus.")
                .httpStatusCode(status)
                .context(Map.of())
                .displayMode("toast")
                .build();
    }

    @Test
    void json_request_gets_status_and_exactly_four_keys() {
        ErrorResponse response = builder.build(info(BlockingLevel.BLOCKING, 422), RequestShape.json("/uploading/default"));

        assertThat(response.getKind()).isEqualTo(ErrorResponse.Kind.JSON);
        assertThat(response.getStatus()).isEqualTo(422);
        assertThat(response.getBody()).containsOnlyKeys("error_code", "user_message", "blocking", "display_mode");
        assertThat(response.getBody()).containsEntry("error_code", "VIRUS_FOUND")
                .containsEntry("user_message", "The file contains a virus.")
                .containsEntry("blocking", "blocking")
                .containsEntry("display_mode", "toast");
    }

    @Test
    void api_path_is_answered_with_json_even_without_accept_header() {
        ErrorResponse response = builder.build(info(BlockingLevel.NOT, 400), RequestShape.html("/api/system/upload-limits"));

        assertThat(response.getKind()).isEqualTo(ErrorResponse.Kind.JSON);
        assertThat(response.getBody()).containsEntry("blocking", "not");
    }

    @Test
    void blocking_error_in_html_context_is_blocking() {
        ErrorResponse response = builder.build(info(BlockingLevel.BLOCKING, 500), RequestShape.html("/upload"));

        assertThat(response.getKind()).isEqualTo(ErrorResponse.Kind.BLOCKING);
        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getBody()).isNull();
    }

    @Test
    void non_blocking_error_in_html_context_continues() {
        assertThat(builder.build(info(BlockingLevel.SEMI_BLOCKING, 500), RequestShape.html("/upload")).getKind())
                .isEqualTo(ErrorResponse.Kind.CONTINUE);
        assertThat(builder.build(info(BlockingLevel.NOT, 500), null).getKind())
                .isEqualTo(ErrorResponse.Kind.CONTINUE);
    }
}
