package de.jwiegmann.ultraupload.control.error;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Anwendungsereignis für Fehler, die eine Benachrichtigung des Entwicklerteams verlangen.
 */
@Value
@Builder
public class ErrorOccurredEvent {
    String errorCode;
    ErrorType type;
    BlockingLevel blocking;
    String devMessage;
    Map<String, Object> context;
    ExceptionSummary exception;
    List<String> recipients;
}
