package de.jwiegmann.ultraupload.control.scan;

import java.nio.file.Path;

public interface VirusScanner {

    /**
     * Scannt die Datei. Liefert bei Problemen des Scanners ein ERROR-Ergebnis statt zu werfen.
     */
    ScanResult scan(Path file);
}
