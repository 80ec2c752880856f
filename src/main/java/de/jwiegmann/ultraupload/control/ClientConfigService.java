package de.jwiegmann.ultraupload.control;

import de.jwiegmann.ultraupload.boundary.dto.GlobalConfigResponse;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import de.jwiegmann.ultraupload.control.i18n.Translator;
import de.jwiegmann.ultraupload.control.limits.UploadLimits;
import de.jwiegmann.ultraupload.control.limits.UploadLimitsNegotiator;
import de.jwiegmann.ultraupload.control.simulation.EnvironmentPolicy;
import de.jwiegmann.ultraupload.control.validation.FilePolicy;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stellt die Konfiguration zusammen, die Upload-Clients beim Start abrufen.
 */
@Service
public class ClientConfigService {

    /**
     * Übersetzungen, die der Client für Validierung und Statusanzeige braucht.
     */
    static final List<String> CLIENT_TRANSLATION_KEYS = List.of(
            FilePolicy.MSG_EXTENSION,
            FilePolicy.MSG_MIME_TYPE,
            FilePolicy.MSG_SIZE,
            FilePolicy.MSG_FILENAME,
            "upload_success",
            "upload_failed",
            "upload_cancelled",
            "virus_scan_in_progress",
            "virus_scan_disabled",
            "scan_error_continue",
            "scan_error_stopped");

    static final String TRANSLATION_PREFIX = "upload.client.";

    private final UltraUploadProperties properties;
    private final UploadLimitsNegotiator limitsNegotiator;
    private final EnvironmentPolicy environmentPolicy;
    private final Translator translator;

    public ClientConfigService(UltraUploadProperties properties,
                               UploadLimitsNegotiator limitsNegotiator,
                               EnvironmentPolicy environmentPolicy,
                               Translator translator) {
        this.properties = properties;
        this.limitsNegotiator = limitsNegotiator;
        this.environmentPolicy = environmentPolicy;
        this.translator = translator;
    }

    public GlobalConfigResponse globalConfig() {
        Map<String, String> translations = new LinkedHashMap<>();
        for (String key : CLIENT_TRANSLATION_KEYS) {
            translator.translate(TRANSLATION_PREFIX + key, Map.of())
                    .ifPresent(text -> translations.put(key, text));
        }

        return GlobalConfigResponse.builder()
                .currentLang(LocaleContextHolder.getLocale().getLanguage())
                .availableLangs(List.copyOf(properties.getAvailableLocales()))
                .translations(translations)
                .envMode(environmentPolicy.currentEnvironment())
                .allowedExtensions(List.copyOf(properties.getAllowedExtensions()))
                .allowedMimeTypes(List.copyOf(properties.getAllowedMimeTypes()))
                .maxSize(properties.getMaxSize())
                .uploadTypePaths(new LinkedHashMap<>(properties.getUploadTypePaths()))
                .defaultUploadType(properties.getDefaultUploadType())
                .build();
    }

    public UploadLimitsResponse uploadLimits() {
        UploadLimits limits = limitsNegotiator.getEffectiveLimits();
        return UploadLimitsResponse.builder()
                .maxTotalSize(limits.getMaxTotalSize().getValue())
                .maxFileSize(limits.getMaxFileSize().getValue())
                .maxFiles((int) limits.getMaxFiles().getValue())
                .maxTotalSizeFormatted(limits.getMaxTotalSize().getFormatted())
                .maxFileSizeFormatted(limits.getMaxFileSize().getFormatted())
                .build();
    }
}
