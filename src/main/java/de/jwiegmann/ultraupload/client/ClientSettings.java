package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.client.transport.UploadTransport;
import de.jwiegmann.ultraupload.control.scan.ScanErrorPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Einstellungen des Upload-Clients.
 * {@code scanErrorPolicy} hat keinen Default und muss gesetzt werden, solange gescannt wird.
 */
@Value
@Builder
public class ClientSettings {

    String baseUrl;

    String csrfToken;

    /** Gesamtzahl der Versuche pro Datei. */
    @Builder.Default
    int maxRetries = UploadTransport.DEFAULT_MAX_RETRIES;

    /** Gleichzeitig laufende Dateien. */
    @Builder.Default
    int concurrency = 3;

    @Builder.Default
    boolean scanEnabled = true;

    @Builder.Default
    Duration scanTimeout = Duration.ofMinutes(2);

    ScanErrorPolicy scanErrorPolicy;

    public ScanErrorPolicy requireScanErrorPolicy() {
        if (scanErrorPolicy == null) {
            throw new IllegalStateException("scanErrorPolicy must be configured (CONTINUE or STOP)");
        }
        return scanErrorPolicy;
    }
}
