package de.jwiegmann.ultraupload.client.realtime;

/**
 * Empfänger für Scan-Ereignisse. Ein fehlender Dateiname betrifft alle wartenden Dateien.
 */
public interface ScanEventSink {

    void onScanClean(String fileName, String message);

    void onScanInfected(String fileName, String message);

    void onScanError(String fileName, String message);

    void onUploadFailed(String fileName, String message);
}
