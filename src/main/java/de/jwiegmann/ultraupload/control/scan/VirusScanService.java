package de.jwiegmann.ultraupload.control.scan;

import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import de.jwiegmann.ultraupload.control.error.ErrorManager;
import de.jwiegmann.ultraupload.control.error.RequestShape;
import de.jwiegmann.ultraupload.control.repository.InMemoryStoredFileRepository;
import de.jwiegmann.ultraupload.entity.StoredFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Scannt gespeicherte Dateien asynchron und meldet den Fortschritt auf dem Kanal "upload".
 */
@Slf4j(topic = "ultra.upload")
@Service
public class VirusScanService {

    private final VirusScanner scanner;
    private final UploadEventPublisher eventPublisher;
    private final InMemoryStoredFileRepository fileRepository;
    private final ErrorManager errorManager;
    private final TaskExecutor executor;
    private final UltraUploadProperties.Scan settings;

    public VirusScanService(VirusScanner scanner,
                            UploadEventPublisher eventPublisher,
                            InMemoryStoredFileRepository fileRepository,
                            ErrorManager errorManager,
                            @Qualifier("virusScanExecutor") TaskExecutor executor,
                            UltraUploadProperties properties) {
        this.scanner = scanner;
        this.eventPublisher = eventPublisher;
        this.fileRepository = fileRepository;
        this.errorManager = errorManager;
        this.executor = executor;
        this.settings = properties.getScan();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Startet den Scan im Hintergrund. Bei deaktiviertem Scan passiert nichts.
     */
    public void scanAsync(StoredFile file) {
        if (!settings.isEnabled()) {
            fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.NOT_SCANNED, null);
            return;
        }
        // Policy vor dem Start prüfen, damit Fehlkonfiguration sofort auffällt
        requirePolicy();
        executor.execute(() -> scan(file));
    }

    /**
     * Startet einen weiteren Scan, solange die Datei weniger als {@code maxAttempts} Scans hatte.
     *
     * @return true, wenn ein Scan angestoßen wurde
     */
    public boolean retryScan(StoredFile file, int maxAttempts) {
        if (!settings.isEnabled()) {
            return false;
        }
        if (file.getScanAttempts() >= maxAttempts) {
            log.warn("No further scan of {}: {} of {} attempts used",
                    file.getOriginalName(), file.getScanAttempts(), maxAttempts);
            return false;
        }
        fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.PENDING, null);
        executor.execute(() -> scan(file));
        return true;
    }

    void scan(StoredFile file) {
        String fileName = file.getOriginalName();
        file.setScanAttempts(file.getScanAttempts() + 1);
        try {
            eventPublisher.publish(UploadEvent.of(UploadEvent.VIRUS_SCAN,
                    "Virus scan in progress: " + fileName, fileName));

            ScanResult result = scanner.scan(file.getStoredPath());
            switch (result.getVerdict()) {
                case CLEAN:
                    fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.CLEAN, null);
                    eventPublisher.publish(UploadEvent.of(UploadEvent.ALL_CLEAN,
                            "All files were scanned. No infected files.", fileName));
                    break;
                case INFECTED:
                    fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.INFECTED, result.getDetails());
                    reportError("VIRUS_FOUND", file, result);
                    eventPublisher.publish(UploadEvent.of(UploadEvent.SOME_INFECTED,
                            "Virus found in " + fileName + ", the file was rejected.", fileName));
                    break;
                default:
                    handleScanError(file, result);
            }
        } catch (RuntimeException e) {
            log.error("Virus scan of {} failed: {}", fileName, e.getMessage(), e);
            fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.SCAN_FAILED, e.getMessage());
            eventPublisher.publish(UploadEvent.of(UploadEvent.UPLOAD_FAILED,
                    "Upload failed during virus scan of " + fileName, fileName));
        }
    }

    private void handleScanError(StoredFile file, ScanResult result) {
        reportError("SCAN_ERROR", file, result);
        if (requirePolicy() == ScanErrorPolicy.CONTINUE) {
            fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.SCAN_SKIPPED, result.getDetails());
            eventPublisher.publish(UploadEvent.of(UploadEvent.END_VIRUS_SCAN,
                    "Virus scan could not be completed, the scan was skipped.", file.getOriginalName()));
        } else {
            // uploadFailed ist für jeden Client endgültig, unabhängig von dessen eigener Policy
            fileRepository.updateScanStatus(file.getId(), StoredFile.ScanStatus.SCAN_FAILED, result.getDetails());
            eventPublisher.publish(UploadEvent.of(UploadEvent.UPLOAD_FAILED,
                    "Virus scan could not be completed, the upload was stopped.", file.getOriginalName()));
        }
    }

    private void reportError(String errorCode, StoredFile file, ScanResult result) {
        Map<String, Object> context = new HashMap<>();
        context.put("fileName", file.getOriginalName());
        context.put("fileId", file.getId());
        context.put("details", result.getDetails());
        errorManager.handle(errorCode, context, null, RequestShape.json("/uploading/" + file.getUploadType()));
    }

    private ScanErrorPolicy requirePolicy() {
        ScanErrorPolicy policy = settings.getOnError();
        if (policy == null) {
            throw new IllegalStateException("ultra.upload.scan.on-error must be configured (CONTINUE or STOP)");
        }
        return policy;
    }
}
