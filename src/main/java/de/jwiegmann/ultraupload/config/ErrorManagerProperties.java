package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.control.error.ContextSanitizer;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statische Fehlerdefinitionen und Handler-Einstellungen unter "ultra.errors".
 */
@Data
@ConfigurationProperties(prefix = "ultra.errors")
public class ErrorManagerProperties {

    /**
     * Fehlercode -> Konfiguration.
     */
    private Map<String, ErrorConfig> definitions = new LinkedHashMap<>();

    /**
     * Letzte Rückfallebene, wenn weder der Code noch UNDEFINED_ERROR_CODE definiert sind.
     */
    private ErrorConfig fallbackError;

    private Ui ui = new Ui();

    private Notification notification = new Notification();

    private DatabaseLogging databaseLogging = new DatabaseLogging();

    private Recovery recovery = new Recovery();

    @Data
    public static class Ui {

        private String defaultDisplayMode = "div";

        private boolean showErrorCodes = false;

        private String genericErrorMessageKey = "errors.user.generic_error";
    }

    @Data
    public static class Notification {

        private boolean enabled = false;

        private List<String> recipients = new ArrayList<>();

        /**
         * Absenderadresse, leer = Default des Mailservers.
         */
        private String from;

        private String subjectPrefix = "[UEM Error] ";

        private boolean includeContext = true;
    }

    /**
     * Persistenz behandelter Fehler für das Dashboard.
     */
    @Data
    public static class DatabaseLogging {

        private boolean enabled = true;

        private boolean includeTrace = true;

        private int maxTraceLength = 10000;

        private List<String> sensitiveKeys = new ArrayList<>(ContextSanitizer.DEFAULT_SENSITIVE_KEYS);
    }

    @Data
    public static class Recovery {

        /**
         * Verzögerung für schedule_cleanup.
         */
        private Duration cleanupDelay = Duration.ofMinutes(5);

        /**
         * Gesamtzahl der Scans pro Datei inklusive retry_scan.
         */
        private int maxScanAttempts = 2;
    }
}
