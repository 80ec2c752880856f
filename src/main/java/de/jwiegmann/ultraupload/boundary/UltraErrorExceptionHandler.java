package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.control.error.ErrorManager;
import de.jwiegmann.ultraupload.control.exception.UltraErrorException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.util.HtmlUtils;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j(topic = "ultra.errors")
@RestControllerAdvice
@RequiredArgsConstructor
public class UltraErrorExceptionHandler {

    private final ErrorManager errorManager;
    private final ErrorResponseAdapter adapter;

    @ExceptionHandler(UltraErrorException.class)
    public ResponseEntity<Object> handleUltraError(UltraErrorException e, HttpServletRequest request) {
        if (e.isFatalFallbackFailure()) {
            log.error("Fatal error resolution failure on {}: {}", request.getRequestURI(), e.getMessage());
        }
        if (adapter.shapeOf(request).wantsJson()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error_code", e.getErrorCode());
            body.put("user_message", e.getMessage());
            body.put("blocking", "blocking");
            return ResponseEntity.status(e.getHttpStatus())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body);
        }
        String page = "<!DOCTYPE html><html><head><title>Error " + e.getHttpStatus() + "</title></head>"
                + "<body><h1>" + HtmlUtils.htmlEscape(String.valueOf(e.getMessage())) + "</h1>"
                + "<p>" + HtmlUtils.htmlEscape(e.getErrorCode()) + "</p></body></html>";
        return ResponseEntity.status(e.getHttpStatus())
                .contentType(MediaType.TEXT_HTML)
                .body(page);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Object> handleMaxUploadSize(MaxUploadSizeExceededException e, HttpServletRequest request) {
        Map<String, Object> context = new HashMap<>();
        context.put("maxUploadSize", e.getMaxUploadSize());
        try {
            return adapter.toResponseEntity(
                    errorManager.handle("MAX_FILE_SIZE", context, e, adapter.shapeOf(request)));
        } catch (UltraErrorException blocking) {
            return handleUltraError(blocking, request);
        }
    }
}
