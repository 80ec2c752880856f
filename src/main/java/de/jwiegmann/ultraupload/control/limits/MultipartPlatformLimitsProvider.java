package de.jwiegmann.ultraupload.control.limits;

import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.web.servlet.MultipartProperties;
import org.springframework.stereotype.Component;

/**
 * Plattformgrenzen aus der Servlet-Multipart-Konfiguration
 * (spring.servlet.multipart.max-request-size / max-file-size).
 * Negative Werte bedeuten dort "unbegrenzt".
 */
@Component
@RequiredArgsConstructor
public class MultipartPlatformLimitsProvider implements PlatformLimitsProvider {

    private final MultipartProperties multipartProperties;
    private final UltraUploadProperties uploadProperties;

    @Override
    public RawLimits platformLimits() {
        return RawLimits.builder()
                .maxTotalSize(unboundedIfNegative(multipartProperties.getMaxRequestSize().toBytes()))
                .maxFileSize(unboundedIfNegative(multipartProperties.getMaxFileSize().toBytes()))
                .maxFiles(uploadProperties.getPlatformMaxFileUploads())
                .build();
    }

    private static long unboundedIfNegative(long bytes) {
        return bytes < 0 ? Long.MAX_VALUE : bytes;
    }
}
