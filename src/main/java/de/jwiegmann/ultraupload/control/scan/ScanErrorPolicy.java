package de.jwiegmann.ultraupload.control.scan;

/**
 * Verhalten, wenn der Virenscan selbst fehlschlägt (nicht bei Virusfund).
 */
public enum ScanErrorPolicy {
    /** Datei trotzdem übernehmen, Scan gilt als übersprungen. */
    CONTINUE,
    /** Datei verwerfen. */
    STOP
}
