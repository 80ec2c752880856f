package de.jwiegmann.ultraupload.control.error;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ergebnis des ErrorResponseBuilder. Wird erst an der Web-Grenze in eine
 * HTTP-Antwort oder Exception übersetzt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    public enum Kind {
        /** JSON-Body mit Status. */
        JSON,
        /** Blockierender Fehler im HTML-Kontext. */
        BLOCKING,
        /** Nicht blockierend, Request läuft normal weiter. */
        CONTINUE
    }

    Kind kind;
    int status;
    Map<String, Object> body;
    ErrorInfo errorInfo;

    public static ErrorResponse json(ErrorInfo info) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", info.getErrorCode());
        body.put("user_message", info.getUserMessage());
        body.put("blocking", info.getBlocking().value());
        body.put("display_mode", info.getDisplayMode());
        return new ErrorResponse(Kind.JSON, info.getHttpStatusCode(), Collections.unmodifiableMap(body), info);
    }

    public static ErrorResponse blocking(ErrorInfo info) {
        return new ErrorResponse(Kind.BLOCKING, info.getHttpStatusCode(), null, info);
    }

    public static ErrorResponse proceed(ErrorInfo info) {
        return new ErrorResponse(Kind.CONTINUE, info.getHttpStatusCode(), null, info);
    }
}
