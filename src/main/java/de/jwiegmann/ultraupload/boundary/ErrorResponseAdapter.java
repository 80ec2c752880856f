package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.control.error.ErrorInfo;
import de.jwiegmann.ultraupload.control.error.ErrorResponse;
import de.jwiegmann.ultraupload.control.error.RequestShape;
import de.jwiegmann.ultraupload.control.exception.UltraErrorException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Übersetzt {@link ErrorResponse} in Spring-MVC-Antworten.
 * Einzige Stelle, an der ein blockierender HTML-Fehler zur Exception wird.
 */
@Component
public class ErrorResponseAdapter {

    static final String XHR = "XMLHttpRequest";

    public RequestShape shapeOf(HttpServletRequest request) {
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        boolean acceptsJson = accept != null && accept.contains(MediaType.APPLICATION_JSON_VALUE);
        boolean xhr = XHR.equals(request.getHeader("X-Requested-With"));
        return new RequestShape(acceptsJson || xhr, request.getRequestURI());
    }

    /**
     * @throws UltraErrorException bei {@link ErrorResponse.Kind#BLOCKING}
     */
    public ResponseEntity<Object> toResponseEntity(ErrorResponse response) {
        switch (response.getKind()) {
            case JSON:
                return ResponseEntity.status(response.getStatus())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(response.getBody());
            case BLOCKING:
                ErrorInfo info = response.getErrorInfo();
                throw new UltraErrorException(info.getUserMessage(), info.getHttpStatusCode(), null,
                        info.getErrorCode(), info.getContext());
            case CONTINUE:
            default:
                return ResponseEntity.noContent().build();
        }
    }
}
