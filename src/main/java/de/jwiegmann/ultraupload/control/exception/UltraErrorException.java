package de.jwiegmann.ultraupload.control.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typisierter Fehler mit aufgelöstem Code, HTTP-Status und Kontext.
 * Wird für blockierende Fehler im HTML-Kontext sowie für FATAL_FALLBACK_FAILURE geworfen.
 */
@Getter
public class UltraErrorException extends RuntimeException {

    public static final String FATAL_FALLBACK_FAILURE = "FATAL_FALLBACK_FAILURE";

    private final String errorCode;
    private final int httpStatus;
    private final Map<String, Object> context;

    public UltraErrorException(String message, int httpStatus, Throwable cause,
                               String errorCode, Map<String, Object> context) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public boolean isFatalFallbackFailure() {
        return FATAL_FALLBACK_FAILURE.equals(errorCode);
    }
}
