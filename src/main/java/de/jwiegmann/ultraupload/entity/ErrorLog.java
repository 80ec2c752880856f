package de.jwiegmann.ultraupload.entity;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Gespeicherter Fehlerfall für das Fehler-Dashboard.
 * Der Kontext ist bereits bereinigt, sensible Werte sind ersetzt.
 */
@Data
@Builder
public class ErrorLog {

    private Long id;
    private final String errorCode;
    private final String type;
    private final String blocking;
    private final String message;
    private final String userMessage;
    private final int httpStatusCode;
    private final Map<String, Object> context;
    private final String displayMode;

    private final String exceptionClass;
    private final String exceptionMessage;
    private final String exceptionTrace;

    private boolean resolved;
    private LocalDateTime resolvedAt;
    private String resolvedBy;
    private String resolutionNotes;

    private final LocalDateTime createdAt;

    public void markAsResolved(String by, String notes, LocalDateTime at) {
        this.resolved = true;
        this.resolvedAt = at;
        this.resolvedBy = by;
        this.resolutionNotes = notes;
    }

    public void markAsUnresolved() {
        this.resolved = false;
        this.resolvedAt = null;
        this.resolvedBy = null;
        this.resolutionNotes = null;
    }
}
