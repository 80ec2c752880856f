package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.boundary.dto.GlobalConfigResponse;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.control.validation.FilePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Liest Client-Konfiguration und Upload-Grenzen vom Server.
 */
@Slf4j(topic = "ultra.upload")
public class UploadConfigClient {

    public static final String GLOBAL_CONFIG_PATH = "/config/global-config";
    public static final String UPLOAD_LIMITS_PATH = "/api/system/upload-limits";

    private final RestClient restClient;

    public UploadConfigClient(RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * @throws RestClientException wenn die Konfiguration nicht geladen werden kann
     */
    public GlobalConfigResponse fetchGlobalConfig() {
        GlobalConfigResponse config = restClient.get()
                .uri(GLOBAL_CONFIG_PATH)
                .retrieve()
                .body(GlobalConfigResponse.class);
        if (config == null) {
            throw new RestClientException("Empty response from " + GLOBAL_CONFIG_PATH);
        }
        return config;
    }

    /**
     * Liefert bei Fehlern die Standardgrenzen (20 Dateien, 10 MB je Datei, 50 MB gesamt).
     */
    public UploadLimitsResponse fetchUploadLimits() {
        try {
            UploadLimitsResponse limits = restClient.get()
                    .uri(UPLOAD_LIMITS_PATH)
                    .retrieve()
                    .body(UploadLimitsResponse.class);
            if (limits != null) {
                return limits;
            }
            log.warn("Empty upload limits response, using defaults");
        } catch (RestClientException e) {
            log.error("Could not load upload limits, using defaults: {}", e.getMessage());
        }
        return defaultLimits();
    }

    public static UploadLimitsResponse defaultLimits() {
        return UploadLimitsResponse.builder()
                .maxTotalSize(52_428_800L)
                .maxFileSize(10_485_760L)
                .maxFiles(20)
                .maxTotalSizeFormatted("50 MB")
                .maxFileSizeFormatted("10 MB")
                .build();
    }

    /**
     * Datei-Policy aus der globalen Konfiguration, Meldungsvorlagen aus den Übersetzungen.
     */
    public static FilePolicy filePolicyOf(GlobalConfigResponse config) {
        FilePolicy.FilePolicyBuilder policy = FilePolicy.builder()
                .allowedExtensions(config.getAllowedExtensions())
                .allowedMimeTypes(config.getAllowedMimeTypes())
                .maxSize(config.getMaxSize());
        Map<String, String> translations = config.getTranslations() == null ? Map.of() : config.getTranslations();
        for (String key : new String[]{FilePolicy.MSG_EXTENSION, FilePolicy.MSG_MIME_TYPE,
                FilePolicy.MSG_SIZE, FilePolicy.MSG_FILENAME}) {
            if (translations.containsKey(key)) {
                policy.message(key, translations.get(key));
            }
        }
        return policy.build();
    }

    public static UploadTypeRegistry uploadTypesOf(GlobalConfigResponse config) {
        return new UploadTypeRegistry(config.getUploadTypePaths(), config.getDefaultUploadType());
    }
}
