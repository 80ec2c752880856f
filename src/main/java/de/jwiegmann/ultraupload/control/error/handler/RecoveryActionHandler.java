package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.repository.InMemoryStoredFileRepository;
import de.jwiegmann.ultraupload.control.scan.VirusScanService;
import de.jwiegmann.ultraupload.entity.StoredFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Führt die im ErrorConfig hinterlegte Gegenmaßnahme aus.
 *
 * <ul>
 *     <li>{@code retry_upload}: Wiederholung übernimmt der Client-Transport, serverseitig nur protokolliert</li>
 *     <li>{@code retry_scan}: Datei aus {@code fileId} erneut scannen, begrenzt durch maxScanAttempts</li>
 *     <li>{@code create_temp_directory}: Verzeichnis aus {@code directory} bzw. Speicherpfad anlegen</li>
 *     <li>{@code schedule_cleanup}: Datei aus {@code fileId} nach cleanupDelay löschen</li>
 * </ul>
 */
@Slf4j(topic = "ultra.errors")
public class RecoveryActionHandler implements ErrorHandler {

    public static final String RETRY_UPLOAD = "retry_upload";
    public static final String RETRY_SCAN = "retry_scan";
    public static final String CREATE_TEMP_DIRECTORY = "create_temp_directory";
    public static final String SCHEDULE_CLEANUP = "schedule_cleanup";

    private final Path storageRoot;
    private final InMemoryStoredFileRepository fileRepository;
    private final ObjectProvider<VirusScanService> virusScanService;
    private final TaskScheduler scheduler;
    private final ErrorManagerProperties.Recovery settings;
    private final Clock clock;

    public RecoveryActionHandler(String storagePath,
                                 InMemoryStoredFileRepository fileRepository,
                                 ObjectProvider<VirusScanService> virusScanService,
                                 TaskScheduler scheduler,
                                 ErrorManagerProperties.Recovery settings,
                                 Clock clock) {
        this.storageRoot = Paths.get(storagePath).toAbsolutePath().normalize();
        this.fileRepository = fileRepository;
        this.virusScanService = virusScanService;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        return config.getRecoveryAction() != null && !config.getRecoveryAction().isBlank();
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        String action = config.getRecoveryAction();
        log.info("Attempting recovery action {} for {}", action, errorCode);

        boolean success;
        switch (action) {
            case RETRY_UPLOAD:
                log.info("Upload of {} is retried by the client transport", context.get("fileName"));
                success = false;
                break;
            case RETRY_SCAN:
                success = retryScan(context);
                break;
            case CREATE_TEMP_DIRECTORY:
                success = createTempDirectory(context);
                break;
            case SCHEDULE_CLEANUP:
                success = scheduleCleanup(context);
                break;
            default:
                log.warn("Unknown recovery action {} configured for {}", action, errorCode);
                return;
        }

        if (success) {
            log.info("Recovery action {} for {} succeeded", action, errorCode);
        } else {
            log.warn("Recovery action {} for {} did not report success", action, errorCode);
        }
    }

    private boolean retryScan(Map<String, Object> context) {
        Optional<StoredFile> file = storedFile(context);
        if (file.isEmpty()) {
            return false;
        }
        VirusScanService scanService = virusScanService.getIfAvailable();
        return scanService != null && scanService.retryScan(file.get(), settings.getMaxScanAttempts());
    }

    private boolean createTempDirectory(Map<String, Object> context) {
        Path directory = storageRoot;
        Object requested = context.get("directory");
        if (requested != null) {
            Path candidate = Paths.get(requested.toString()).toAbsolutePath().normalize();
            if (candidate.startsWith(storageRoot)) {
                directory = candidate;
            } else {
                log.warn("Refusing to create {} outside of storage path {}", candidate, storageRoot);
            }
        }
        try {
            Files.createDirectories(directory);
            return true;
        } catch (IOException e) {
            log.error("Could not create directory {}: {}", directory, e.getMessage());
            return false;
        }
    }

    private boolean scheduleCleanup(Map<String, Object> context) {
        Optional<StoredFile> file = storedFile(context);
        if (file.isEmpty()) {
            return false;
        }
        Path target = file.get().getStoredPath();
        scheduler.schedule(() -> deleteStoredFile(target), clock.instant().plus(settings.getCleanupDelay()));
        log.info("Cleanup of {} scheduled in {}", target, settings.getCleanupDelay());
        return true;
    }

    private Optional<StoredFile> storedFile(Map<String, Object> context) {
        Object fileId = context.get("fileId");
        if (fileId == null) {
            log.warn("Recovery action needs a fileId in the error context");
            return Optional.empty();
        }
        Optional<StoredFile> file = fileRepository.find(fileId.toString());
        if (file.isEmpty()) {
            log.warn("Stored file {} not found for recovery", fileId);
        }
        return file;
    }

    private static void deleteStoredFile(Path target) {
        try {
            if (Files.deleteIfExists(target)) {
                log.info("Removed {}", target);
            }
        } catch (IOException e) {
            log.error("Could not remove {}: {}", target, e.getMessage());
        }
    }
}
