package de.jwiegmann.ultraupload.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.client.realtime.RealTimeEventListener;
import de.jwiegmann.ultraupload.client.transport.BackoffPolicy;
import de.jwiegmann.ultraupload.client.transport.HttpUploadResponse;
import de.jwiegmann.ultraupload.client.transport.Sleeper;
import de.jwiegmann.ultraupload.client.transport.UploadHttpClient;
import de.jwiegmann.ultraupload.client.transport.UploadPayload;
import de.jwiegmann.ultraupload.client.transport.UploadTransport;
import de.jwiegmann.ultraupload.control.scan.ScanErrorPolicy;
import de.jwiegmann.ultraupload.control.scan.UploadEvent;
import de.jwiegmann.ultraupload.control.validation.ClientFileValidator;
import de.jwiegmann.ultraupload.control.validation.FilePolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadOrchestratorTest {

    private static final String SCAN_STARTED = "{\"message\":\"Upload completed, starting virus scan...\"}";

    private final List<UploadPayload> requests = new CopyOnWriteArrayList<>();
    private final List<String> transitions = new CopyOnWriteArrayList<>();

    private final UploadStatusListener recordingListener = new UploadStatusListener() {
        @Override
        public void onTaskStateChanged(UploadTask task, UploadTaskState from, UploadTaskState to) {
            transitions.add(task.getFileName() + ":" + to);
        }
    };

    private final FilePolicy policy = FilePolicy.builder()
            .allowedExtension("png")
            .allowedExtension("pdf")
            .allowedExtension("xml")
            .allowedMimeType("image/png")
            .allowedMimeType("application/pdf")
            .allowedMimeType("application/xml")
            .maxSize(1024 * 1024)
            .build();

    private final UploadLimitsResponse limits = UploadLimitsResponse.builder()
            .maxFiles(5)
            .maxFileSize(1024 * 1024)
            .maxTotalSize(10 * 1024 * 1024)
            .maxFileSizeFormatted("1 MB")
            .maxTotalSizeFormatted("10 MB")
            .build();

    private UploadOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private UploadOrchestrator orchestrator(ClientSettings settings, UploadHttpClient http, Sleeper sleeper) {
        UploadHttpClient recording = (endpoint, payload) -> {
            requests.add(payload);
            return http.post(endpoint, payload);
        };
        UploadTransport transport = new UploadTransport(recording, new ObjectMapper(), settings.getMaxRetries(),
                new BackoffPolicy(), sleeper);
        orchestrator = new UploadOrchestrator(settings,
                new ClientFileValidator(policy),
                new UploadLimitsValidator(),
                limits,
                new UploadTypeRegistry(Map.of("default", "/uploading/default", "epp", "/uploading/epp"), "default"),
                transport,
                recordingListener);
        return orchestrator;
    }

    private static ClientSettings.ClientSettingsBuilder settings() {
        return ClientSettings.builder()
                .baseUrl("http://localhost:8080")
                .concurrency(1)
                .scanErrorPolicy(ScanErrorPolicy.STOP);
    }

    private static HttpUploadResponse json(int status, String body) {
        return new HttpUploadResponse(status, "application/json", body);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void cancel_keeps_finished_file_and_stops_file_in_backoff() throws Exception {
        // 1) Datei 1 klappt sofort, Datei 2 bekommt 503 und hängt im Backoff
        CountDownLatch inBackoff = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Sleeper blockingSleeper = duration -> {
            inBackoff.countDown();
            release.await(5, TimeUnit.SECONDS);
        };
        UploadOrchestrator uploads = orchestrator(settings().scanEnabled(false).build(),
                (endpoint, payload) -> payload.getFileName().equals("first.png")
                        ? json(200, "{\"message\":\"ok\"}")
                        : json(503, "{\"message\":\"busy\"}"),
                blockingSleeper);
        UploadTask first = uploads.enqueue("first.png", "image/png", bytes("1"), "default");
        UploadTask second = uploads.enqueue("second.png", "image/png", bytes("2"), "default");

        uploads.uploadAll();
        assertThat(inBackoff.await(5, TimeUnit.SECONDS)).isTrue();

        // 2) Abbrechen während des Backoffs
        uploads.cancel();
        release.countDown();
        await(() -> second.getAttempts() == 1);

        // 3) Datei 1 bleibt fertig, Datei 2 ist abgebrochen und wurde nicht erneut gesendet
        assertThat(first.getState()).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(second.getState()).isEqualTo(UploadTaskState.CANCELLED);
        assertThat(requests).extracting(UploadPayload::getFileName).containsExactly("first.png", "second.png");
        assertThat(uploads.completion(second).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.CANCELLED);
        assertThat(uploads.getProgress().getCancelled()).isEqualTo(1);
        assertThat(uploads.getProgress().getFinalized()).isEqualTo(1);
    }

    @Test
    void transport_with_other_retry_ceiling_than_settings_is_rejected() {
        ClientSettings settings = settings().maxRetries(5).build();
        UploadTransport transport = new UploadTransport((endpoint, payload) -> json(200, "{}"), new ObjectMapper(),
                3, new BackoffPolicy(), duration -> { });

        assertThatThrownBy(() -> new UploadOrchestrator(settings,
                new ClientFileValidator(policy),
                new UploadLimitsValidator(),
                limits,
                new UploadTypeRegistry(Map.of("default", "/uploading/default"), "default"),
                transport,
                recordingListener))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3 attempts")
                .hasMessageContaining("configure 5");
    }

    @Test
    void retry_ceiling_from_settings_bounds_attempts_per_file() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().maxRetries(2).scanEnabled(false).build(),
                (endpoint, payload) -> json(503, "{\"message\":\"busy\"}"), duration -> { });
        UploadTask task = uploads.enqueue("busy.png", "image/png", bytes("b"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getAttempts()).isEqualTo(2);
        assertThat(requests).hasSize(2);
    }

    @Test
    void clean_scan_event_finalizes_waiting_file() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(), (endpoint, payload) -> json(200, SCAN_STARTED),
                duration -> { });
        UploadTask task = uploads.enqueue("photo.png", "image/png", bytes("png"), "default");

        uploads.uploadAll();
        await(() -> transitions.contains("photo.png:AWAITING_SCAN"));
        uploads.onScanClean("photo.png", "All files scanned, no virus found.");

        assertThat(uploads.completion(task).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(task.getServerMessage()).isEqualTo("Upload completed, starting virus scan...");
        assertThat(transitions).containsExactly(
                "photo.png:VALIDATING", "photo.png:TRANSMITTING", "photo.png:AWAITING_SCAN", "photo.png:FINALIZED");
        assertThat(requests.get(0).getFields()).containsEntry("index", "0");
    }

    @Test
    void scan_result_arriving_during_transmission_is_applied_afterwards() throws Exception {
        UploadOrchestrator[] holder = new UploadOrchestrator[1];
        UploadOrchestrator uploads = orchestrator(settings().build(), (endpoint, payload) -> {
            holder[0].onScanInfected(payload.getFileName(), "Virus found in " + payload.getFileName());
            return json(200, SCAN_STARTED);
        }, duration -> { });
        holder[0] = uploads;
        UploadTask task = uploads.enqueue("evil.pdf", "application/pdf", bytes("x"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getLastError().getErrorCode()).isEqualTo("VIRUS_FOUND");
        assertThat(task.getLastError().getMessage()).isEqualTo("Virus found in evil.pdf");
    }

    @Test
    void scan_error_with_continue_policy_keeps_the_upload() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().scanErrorPolicy(ScanErrorPolicy.CONTINUE).build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        UploadTask task = uploads.enqueue("doc.pdf", "application/pdf", bytes("pdf"), "default");

        uploads.uploadAll();
        await(() -> transitions.contains("doc.pdf:AWAITING_SCAN"));
        uploads.onScanError("doc.pdf", "clamscan not available");

        assertThat(uploads.completion(task).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(task.getLastError()).isNull();
    }

    @Test
    void server_stopping_after_scan_error_fails_even_with_continue_policy() throws Exception {
        // 1) Client würde Scan-Fehler tolerieren
        UploadOrchestrator uploads = orchestrator(settings().scanErrorPolicy(ScanErrorPolicy.CONTINUE).build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        RealTimeEventListener events = new RealTimeEventListener(null, uploads, UploadStatusListener.NONE);
        UploadTask task = uploads.enqueue("doc.pdf", "application/pdf", bytes("pdf"), "default");

        uploads.uploadAll();
        await(() -> transitions.contains("doc.pdf:AWAITING_SCAN"));

        // 2) Server hat mit STOP abgebrochen
        events.dispatch(UploadEvent.of(UploadEvent.UPLOAD_FAILED,
                "Virus scan could not be completed, the upload was stopped.", "doc.pdf"));

        // 3) Entscheidung des Servers gilt
        assertThat(uploads.completion(task).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getLastError().getMessage()).contains("stopped");
    }

    @Test
    void early_scan_result_of_failed_transfer_does_not_reach_later_file_with_same_name() throws Exception {
        // 1) Erste Übertragung: Scan-Ergebnis kommt an, dann lehnt der Server ab
        UploadOrchestrator[] holder = new UploadOrchestrator[1];
        int[] calls = {0};
        UploadOrchestrator uploads = orchestrator(settings().build(), (endpoint, payload) -> {
            if (calls[0]++ == 0) {
                holder[0].onScanInfected(payload.getFileName(), "Virus found in " + payload.getFileName());
                return json(400, "{\"message\":\"rejected\"}");
            }
            return json(200, SCAN_STARTED);
        }, duration -> { });
        holder[0] = uploads;
        UploadTask rejected = uploads.enqueue("same.pdf", "application/pdf", bytes("1"), "default");
        uploads.uploadAll().get(5, TimeUnit.SECONDS);
        assertThat(rejected.getState()).isEqualTo(UploadTaskState.FAILED);

        // 2) Gleicher Dateiname erneut
        UploadTask retried = uploads.enqueue("same.pdf", "application/pdf", bytes("2"), "default");
        uploads.uploadAll();
        await(() -> retried.getState() == UploadTaskState.AWAITING_SCAN);
        uploads.onScanClean("same.pdf", "All files scanned, no virus found.");

        // 3) Altes Ergebnis wurde verworfen
        assertThat(uploads.completion(retried).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(retried.getLastError()).isNull();
    }

    @Test
    void scan_error_with_stop_policy_fails_the_upload() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        UploadTask task = uploads.enqueue("doc.pdf", "application/pdf", bytes("pdf"), "default");

        uploads.uploadAll();
        await(() -> transitions.contains("doc.pdf:AWAITING_SCAN"));
        uploads.onScanError(null, "clamscan not available");

        assertThat(uploads.completion(task).get(1, TimeUnit.SECONDS)).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getLastError().getErrorCode()).isEqualTo("SCAN_ERROR");
    }

    @Test
    void missing_scan_result_times_out_as_scan_error() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().scanTimeout(Duration.ofMillis(50)).build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        UploadTask task = uploads.enqueue("slow.png", "image/png", bytes("png"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getLastError().getErrorCode()).isEqualTo("SCAN_ERROR");
    }

    @Test
    void server_without_scanner_finalizes_immediately() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(200, "{\"message\":\"Upload completed, virus scan disabled.\",\"scanDisabled\":true}"),
                duration -> { });
        UploadTask task = uploads.enqueue("a.png", "image/png", bytes("png"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(transitions).doesNotContain("a.png:AWAITING_SCAN");
    }

    @Test
    void invalid_file_never_reaches_the_network() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        UploadTask task = uploads.enqueue("virus.exe", "application/octet-stream", bytes("MZ"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.INVALID);
        assertThat(task.getLastError().getErrorCode()).isEqualTo(ClientFileValidator.INVALID_FILE_EXTENSION);
        assertThat(requests).isEmpty();
    }

    @Test
    void batch_over_limits_marks_every_file_invalid() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        for (int i = 0; i < 6; i++) {
            uploads.enqueue("f" + i + ".png", "image/png", bytes("png"), "default");
        }

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(uploads.getTasks()).allSatisfy(task -> {
            assertThat(task.getState()).isEqualTo(UploadTaskState.INVALID);
            assertThat(task.getLastError().getErrorCode()).isEqualTo(UploadLimitsValidator.MAX_FILES);
        });
        assertThat(requests).isEmpty();
    }

    @Test
    void rejected_upload_fails_with_server_error_code() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(413, "{\"error_code\":\"MAX_FILE_SIZE\",\"user_message\":\"Too big\",\"blocking\":\"blocking\"}"),
                duration -> { });
        UploadTask task = uploads.enqueue("a.png", "image/png", bytes("png"), "default");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FAILED);
        assertThat(task.getAttempts()).isEqualTo(1);
        assertThat(task.getLastError().getErrorCode()).isEqualTo("MAX_FILE_SIZE");
        assertThat(task.getLastError().getMessage()).isEqualTo("Too big");
    }

    @Test
    void epp_upload_passes_through_transforming() throws Exception {
        UploadOrchestrator uploads = orchestrator(settings().scanEnabled(false).build(),
                (endpoint, payload) -> json(200, "{\"message\":\"ok\",\"verificationToken\":\"VALID\"}"),
                duration -> { });
        UploadTask task = uploads.enqueue("invoice.xml", "application/xml", bytes("<epp/>"), "epp");

        uploads.uploadAll().get(5, TimeUnit.SECONDS);

        assertThat(task.getState()).isEqualTo(UploadTaskState.FINALIZED);
        assertThat(transitions).containsSubsequence("invoice.xml:TRANSFORMING", "invoice.xml:TRANSMITTING");
        assertThat(requests.get(0).getUploadType()).isEqualTo("epp");
    }

    @Test
    void scanning_without_error_policy_is_rejected() {
        UploadOrchestrator uploads = orchestrator(settings().scanErrorPolicy(null).build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        uploads.enqueue("a.png", "image/png", bytes("png"), "default");

        assertThatThrownBy(uploads::uploadAll).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelled_batch_accepts_no_new_files() {
        UploadOrchestrator uploads = orchestrator(settings().build(),
                (endpoint, payload) -> json(200, SCAN_STARTED), duration -> { });
        uploads.cancel();

        assertThatThrownBy(() -> uploads.enqueue("a.png", "image/png", bytes("png"), "default"))
                .isInstanceOf(IllegalStateException.class);
    }
}
