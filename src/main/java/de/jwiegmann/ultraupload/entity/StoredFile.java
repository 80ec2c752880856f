package de.jwiegmann.ultraupload.entity;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Metadaten einer empfangenen Datei.
 */
@Data
@Builder
public class StoredFile {

    private final String id;
    private final String uploadType;
    private final String originalName;
    private final String extension;
    private final String mimeType;
    private final long size;
    /** MD5 des gespeicherten Inhalts. */
    private final String hash;
    private final Path storedPath;
    private ScanStatus scanStatus;
    private String scanDetails;
    private int scanAttempts;
    private final LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum ScanStatus {PENDING, CLEAN, INFECTED, SCAN_FAILED, SCAN_SKIPPED, NOT_SCANNED}
}
