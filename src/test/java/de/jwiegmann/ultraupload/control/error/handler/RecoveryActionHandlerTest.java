package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.repository.InMemoryStoredFileRepository;
import de.jwiegmann.ultraupload.control.scan.VirusScanService;
import de.jwiegmann.ultraupload.entity.StoredFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecoveryActionHandlerTest {

    @TempDir
    Path storage;

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private ObjectProvider<VirusScanService> scanServiceProvider;

    @Mock
    private VirusScanService scanService;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
    private final InMemoryStoredFileRepository repository = new InMemoryStoredFileRepository();
    private final ErrorManagerProperties.Recovery settings = new ErrorManagerProperties.Recovery();
    private RecoveryActionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new RecoveryActionHandler(storage.toString(), repository, scanServiceProvider, scheduler,
                settings, clock);
    }

    private static ErrorConfig action(String recoveryAction) {
        return ErrorConfig.builder().recoveryAction(recoveryAction).build();
    }

    private StoredFile storedFile(Path path) {
        return repository.save(StoredFile.builder()
                .id("file-1")
                .uploadType("default")
                .originalName("invoice.pdf")
                .storedPath(path)
                .scanStatus(StoredFile.ScanStatus.INFECTED)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    @Test
    void only_errors_with_a_recovery_action_are_handled() {
        assertThat(handler.shouldHandle(action(RecoveryActionHandler.RETRY_SCAN))).isTrue();
        assertThat(handler.shouldHandle(action(" "))).isFalse();
        assertThat(handler.shouldHandle(new ErrorConfig())).isFalse();
    }

    @Test
    void create_temp_directory_creates_requested_directory_below_storage() {
        Path requested = storage.resolve("default/2026");

        handler.handle("TEMP_FILE_NOT_FOUND", action(RecoveryActionHandler.CREATE_TEMP_DIRECTORY),
                Map.of("directory", requested.toString()), null);

        assertThat(requested).isDirectory();
    }

    @Test
    void create_temp_directory_ignores_directories_outside_storage(@TempDir Path elsewhere) {
        Path outside = elsewhere.resolve("escape");

        handler.handle("TEMP_FILE_NOT_FOUND", action(RecoveryActionHandler.CREATE_TEMP_DIRECTORY),
                Map.of("directory", storage.resolve("../" + elsewhere.getFileName() + "/escape").toString()), null);
        handler.handle("TEMP_FILE_NOT_FOUND", action(RecoveryActionHandler.CREATE_TEMP_DIRECTORY),
                Map.of("directory", outside.toString()), null);

        assertThat(outside).doesNotExist();
        assertThat(storage).isDirectory();
    }

    @Test
    void schedule_cleanup_deletes_stored_file_after_delay() throws Exception {
        // 1) Infizierte Datei liegt im Speicher
        Path infected = Files.writeString(storage.resolve("invoice.pdf"), "X5O!P%@AP");
        storedFile(infected);
        settings.setCleanupDelay(Duration.ofMinutes(5));

        // 2) Aufräumen einplanen
        handler.handle("VIRUS_FOUND", action(RecoveryActionHandler.SCHEDULE_CLEANUP), Map.of("fileId", "file-1"), null);

        // 3) Zeitpunkt prüfen und Aufgabe ausführen
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(task.capture(), eq(Instant.parse("2026-03-10T12:05:00Z")));
        assertThat(infected).exists();
        task.getValue().run();
        assertThat(infected).doesNotExist();
    }

    @Test
    void schedule_cleanup_without_known_file_schedules_nothing() {
        handler.handle("VIRUS_FOUND", action(RecoveryActionHandler.SCHEDULE_CLEANUP), Map.of("fileId", "missing"), null);
        handler.handle("VIRUS_FOUND", action(RecoveryActionHandler.SCHEDULE_CLEANUP), Map.of(), null);

        verifyNoInteractions(scheduler);
    }

    @Test
    void retry_scan_hands_file_to_scan_service_with_attempt_limit() {
        StoredFile file = storedFile(storage.resolve("invoice.pdf"));
        settings.setMaxScanAttempts(3);
        when(scanServiceProvider.getIfAvailable()).thenReturn(scanService);
        when(scanService.retryScan(any(), eq(3))).thenReturn(true);

        handler.handle("SCAN_ERROR", action(RecoveryActionHandler.RETRY_SCAN), Map.of("fileId", "file-1"), null);

        verify(scanService).retryScan(file, 3);
    }

    @Test
    void retry_upload_and_unknown_actions_touch_nothing() {
        handler.handle("ERROR_DURING_FILE_UPLOAD", action(RecoveryActionHandler.RETRY_UPLOAD),
                Map.of("fileName", "a.pdf"), null);
        handler.handle("ERROR_DURING_FILE_UPLOAD", action("reboot_server"), Map.of(), null);

        verifyNoInteractions(scheduler, scanServiceProvider);
    }
}
