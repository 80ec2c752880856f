package de.jwiegmann.ultraupload.control.error;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Vollständig aufgelöstes, lokalisiertes Ergebnis einer Fehlerbehandlung.
 * Einmal pro handle() erzeugt und danach unveränderlich.
 */
@Value
@Builder
public class ErrorInfo {

    /** Aufgelöster Code, nach Fallback ggf. verschieden vom angefragten. */
    String errorCode;
    ErrorType type;
    BlockingLevel blocking;
    String message;
    String userMessage;
    int httpStatusCode;
    Map<String, Object> context;
    String displayMode;
    OffsetDateTime timestamp;
    ExceptionSummary exception;
}
