package de.jwiegmann.ultraupload.control.scan;

import lombok.Value;

@Value
public class ScanResult {

    public enum Verdict {CLEAN, INFECTED, ERROR}

    Verdict verdict;
    String details;

    public static ScanResult clean() {
        return new ScanResult(Verdict.CLEAN, null);
    }

    public static ScanResult infected(String details) {
        return new ScanResult(Verdict.INFECTED, details);
    }

    public static ScanResult error(String details) {
        return new ScanResult(Verdict.ERROR, details);
    }
}
