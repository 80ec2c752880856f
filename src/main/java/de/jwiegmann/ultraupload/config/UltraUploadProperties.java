package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.control.scan.ScanErrorPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anwendungsseitige Upload-Konfiguration unter dem Präfix "ultra.upload".
 *
 * <pre>
 * ultra:
 *   upload:
 *     max-total-size: 100M
 *     max-file-size: 20M
 *     max-files: 50
 *     scan:
 *       enabled: true
 *       on-error: CONTINUE
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "ultra.upload")
public class UltraUploadProperties {

    /**
     * Maximale Gesamtgröße eines Requests (Größenangabe, z.B. "100M").
     */
    private String maxTotalSize = "100M";

    /**
     * Maximale Größe einer einzelnen Datei.
     */
    private String maxFileSize = "20M";

    private int maxFiles = 50;

    /**
     * Plattformseitige Obergrenze für Dateien pro Request (Gegenstück zu max_file_uploads).
     */
    private int platformMaxFileUploads = 20;

    private List<String> allowedExtensions = new ArrayList<>();

    private List<String> allowedMimeTypes = new ArrayList<>();

    /**
     * Größenlimit in Bytes für die Dateivalidierung.
     */
    private long maxSize = 10L * 1024 * 1024;

    /**
     * Upload-Typ -> Endpunkt-Pfad, z.B. egi -> /uploading/egi
     */
    private Map<String, String> uploadTypePaths = new LinkedHashMap<>();

    private String defaultUploadType = "default";

    private List<String> availableLocales = new ArrayList<>(List.of("it", "en", "fr", "pt", "es", "de"));

    private String storagePath = System.getProperty("java.io.tmpdir") + "/ultra-uploads";

    private Scan scan = new Scan();

    @Data
    public static class Scan {

        private boolean enabled = true;

        private String binary = "clamscan";

        private List<String> options = new ArrayList<>(List.of("--no-summary", "--stdout"));

        private Duration timeout = Duration.ofMinutes(2);

        /**
         * Verhalten bei Scan-Fehlern. Bewusst ohne Default, muss konfiguriert sein.
         */
        private ScanErrorPolicy onError;
    }
}
