package de.jwiegmann.ultraupload.control.error;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Beschreibung eines Fehlercodes: Typ, Schweregrad, Meldungen, HTTP-Status,
 * Anzeigekanal und Benachrichtigungsbedarf.
 * Wird aus der Konfiguration gebunden oder zur Laufzeit über defineError registriert.
 * Nicht gesetzte Felder fallen auf error / blocking / 500 zurück.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ErrorConfig {

    private ErrorType type;
    private BlockingLevel blocking;

    private String devMessage;
    private String devMessageKey;
    private String userMessage;
    private String userMessageKey;

    private Integer httpStatusCode;

    /**
     * Anzeigekanal: div, sweet-alert, toast, log-only. Null = UI-Default.
     */
    private String msgTo;

    /**
     * Entwicklerteam benachrichtigen.
     */
    private boolean devTeamEmailNeed;

    /**
     * Automatische Gegenmaßnahme: retry_upload, retry_scan, create_temp_directory, schedule_cleanup.
     */
    private String recoveryAction;

    public ErrorType resolvedType() {
        return type != null ? type : ErrorType.ERROR;
    }

    public BlockingLevel resolvedBlocking() {
        return blocking != null ? blocking : BlockingLevel.BLOCKING;
    }

    public int resolvedHttpStatusCode() {
        return httpStatusCode != null ? httpStatusCode : 500;
    }
}
