package de.jwiegmann.ultraupload.control.limits;

import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handelt die effektiven Upload-Grenzen aus Plattform- und Anwendungswerten aus.
 * Das Ergebnis wird einmal berechnet und bis zu einem expliziten {@link #refresh()} wiederverwendet.
 */
@Slf4j(topic = "ultra.upload")
@Service
public class UploadLimitsNegotiator {

    private final PlatformLimitsProvider platformLimitsProvider;
    private final UltraUploadProperties properties;
    private final SizeParser sizeParser;

    private volatile UploadLimits effectiveLimits;

    public UploadLimitsNegotiator(PlatformLimitsProvider platformLimitsProvider,
                                  UltraUploadProperties properties,
                                  SizeParser sizeParser) {
        this.platformLimitsProvider = platformLimitsProvider;
        this.properties = properties;
        this.sizeParser = sizeParser;
    }

    public UploadLimits getEffectiveLimits() {
        UploadLimits current = effectiveLimits;
        if (current == null) {
            current = refresh();
        }
        return current;
    }

    /**
     * Liest beide Quellen neu ein und ersetzt die zwischengespeicherten Grenzen.
     */
    public synchronized UploadLimits refresh() {
        RawLimits platform = platformLimitsProvider.platformLimits();
        RawLimits application = applicationLimits();

        log.info("Raw limits: platform={}, application={}", platform, application);

        UploadLimits negotiated = negotiate(platform, application);
        this.effectiveLimits = negotiated;

        log.info("Effective limits: max_total_size={}, max_file_size={}, max_files={}",
                negotiated.getMaxTotalSize().getValue(),
                negotiated.getMaxFileSize().getValue(),
                negotiated.getMaxFiles().getValue());

        return negotiated;
    }

    /**
     * Reine Verhandlung ohne Zustand: pro Dimension min(Plattform, Anwendung).
     */
    public UploadLimits negotiate(RawLimits platform, RawLimits application) {
        return UploadLimits.builder()
                .maxTotalSize(pick("max_total_size", platform.getMaxTotalSize(), application.getMaxTotalSize(), true))
                .maxFileSize(pick("max_file_size", platform.getMaxFileSize(), application.getMaxFileSize(), true))
                .maxFiles(pick("max_files", platform.getMaxFiles(), application.getMaxFiles(), false))
                .build();
    }

    private RawLimits applicationLimits() {
        return RawLimits.builder()
                .maxTotalSize(sizeParser.parse(properties.getMaxTotalSize()))
                .maxFileSize(sizeParser.parse(properties.getMaxFileSize()))
                .maxFiles(properties.getMaxFiles())
                .build();
    }

    private LimitValue pick(String dimension, long platform, long application, boolean bytes) {
        long effective = Math.min(platform, application);

        LimitSource source;
        if (platform < application) {
            source = LimitSource.PLATFORM;
            // Plattform strenger als konfiguriert: Hinweis auf Fehlkonfiguration
            log.warn("Platform limit for {} ({}) is more restrictive than the application limit ({})",
                    dimension, platform, application);
        } else if (application < platform) {
            source = LimitSource.APPLICATION;
        } else {
            source = LimitSource.EQUAL;
        }

        String formatted = bytes ? SizeFormatter.format(effective) : String.valueOf(effective);
        return new LimitValue(effective, formatted, source);
    }
}
