package de.jwiegmann.ultraupload.client;

import com.fasterxml.jackson.databind.JsonNode;
import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.client.realtime.ScanEventSink;
import de.jwiegmann.ultraupload.client.transport.CancellationToken;
import de.jwiegmann.ultraupload.client.transport.DefaultUploadStrategy;
import de.jwiegmann.ultraupload.client.transport.HttpUploadResponse;
import de.jwiegmann.ultraupload.client.transport.TransportResult;
import de.jwiegmann.ultraupload.client.transport.UploadError;
import de.jwiegmann.ultraupload.client.transport.UploadErrors;
import de.jwiegmann.ultraupload.client.transport.UploadPayload;
import de.jwiegmann.ultraupload.client.transport.UploadTransport;
import de.jwiegmann.ultraupload.control.scan.ScanErrorPolicy;
import de.jwiegmann.ultraupload.control.validation.ClientFileValidator;
import de.jwiegmann.ultraupload.control.validation.FileCandidate;
import de.jwiegmann.ultraupload.control.validation.FileValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Führt die vorgemerkten Dateien durch validieren, transformieren, übertragen,
 * auf Scan warten und abschließen.
 *
 * <p>Höchstens {@code concurrency} Dateien werden gleichzeitig übertragen. Ein Abbruch
 * verhindert neue Versuche und markiert alle offenen Dateien als CANCELLED; Antworten
 * bereits gesendeter Requests werden danach ignoriert.</p>
 *
 * <p>Scan-Ergebnisse kommen über {@link ScanEventSink}. Trifft ein Ergebnis ein, bevor die
 * HTTP-Antwort verarbeitet ist, wird es vorgemerkt und nach der Übertragung angewendet.</p>
 */
@Slf4j(topic = "ultra.upload")
public class UploadOrchestrator implements ScanEventSink, AutoCloseable {

    private final ClientSettings settings;
    private final ClientFileValidator fileValidator;
    private final UploadLimitsValidator limitsValidator;
    private final UploadLimitsResponse limits;
    private final UploadTypeRegistry uploadTypes;
    private final UploadTransport transport;
    private final UploadStatusListener statusListener;

    private final List<UploadTask> tasks = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<UploadTaskState>> completions = new ConcurrentHashMap<>();
    private final Map<String, Consumer<UploadTask>> earlyScanResults = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> scanTimeouts = new ConcurrentHashMap<>();
    private final CancellationToken cancellation = new CancellationToken();

    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;

    public UploadOrchestrator(ClientSettings settings,
                              ClientFileValidator fileValidator,
                              UploadLimitsValidator limitsValidator,
                              UploadLimitsResponse limits,
                              UploadTypeRegistry uploadTypes,
                              UploadTransport transport,
                              UploadStatusListener statusListener) {
        if (transport.getMaxRetries() != settings.getMaxRetries()) {
            throw new IllegalArgumentException("Transport allows " + transport.getMaxRetries()
                    + " attempts but settings configure " + settings.getMaxRetries());
        }
        this.settings = settings;
        this.fileValidator = fileValidator;
        this.limitsValidator = limitsValidator;
        this.limits = limits;
        this.uploadTypes = uploadTypes;
        this.transport = transport;
        this.statusListener = statusListener == null ? UploadStatusListener.NONE : statusListener;
        this.executor = Executors.newFixedThreadPool(Math.max(1, settings.getConcurrency()), daemonThreads("upload-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("upload-scan-timeout-"));
    }

    public UploadTask enqueue(String fileName, String mimeType, byte[] content, String uploadType) {
        return enqueue(new UploadTask(fileName, mimeType, content, uploadType));
    }

    public UploadTask enqueue(UploadTask task) {
        if (cancellation.isCancelled()) {
            throw new IllegalStateException("Batch was cancelled, no new files accepted");
        }
        tasks.add(task);
        completions.put(task.getId(), new CompletableFuture<>());
        return task;
    }

    /**
     * Startet alle vorgemerkten Dateien. Das Ergebnis ist fertig, wenn jede Datei einen Endzustand erreicht hat.
     *
     * @throws IllegalStateException wenn gescannt wird und keine Scan-Fehler-Policy gesetzt ist
     */
    public CompletableFuture<Void> uploadAll() {
        if (settings.isScanEnabled()) {
            settings.requireScanErrorPolicy();
        }

        List<UploadTask> queued = new ArrayList<>();
        for (UploadTask task : tasks) {
            if (task.getState() == UploadTaskState.QUEUED) {
                queued.add(task);
            }
        }

        List<FileCandidate> candidates = queued.stream().map(UploadTask::toCandidate).toList();
        FileValidationResult batchCheck = limitsValidator.validate(candidates, limits);
        if (!batchCheck.isValid()) {
            log.warn("Batch of {} files rejected: {}", queued.size(), batchCheck.getMessage());
            statusListener.onStatus(batchCheck.getMessage(), StatusKind.ERROR);
            UploadError error = UploadError.builder()
                    .message(batchCheck.getMessage())
                    .errorCode(batchCheck.getErrorCode())
                    .blocking("blocking")
                    .build();
            queued.forEach(task -> finish(task, UploadTaskState.INVALID, error));
            return allOf(queued);
        }

        for (UploadTask task : queued) {
            executor.execute(() -> process(task));
        }
        return allOf(queued);
    }

    public CompletableFuture<UploadTaskState> completion(UploadTask task) {
        return completions.get(task.getId());
    }

    /**
     * Bricht den Batch ab. Abgeschlossene Dateien behalten ihr Ergebnis.
     */
    public void cancel() {
        cancellation.cancel();
        for (UploadTask task : tasks) {
            if (!task.getState().isTerminal()) {
                finish(task, UploadTaskState.CANCELLED, UploadErrors.cancelled());
            }
        }
        statusListener.onStatus("Upload cancelled", StatusKind.WARNING);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public List<UploadTask> getTasks() {
        return List.copyOf(tasks);
    }

    public UploadProgress getProgress() {
        int finalized = 0;
        int failed = 0;
        int invalid = 0;
        int cancelled = 0;
        for (UploadTask task : tasks) {
            switch (task.getState()) {
                case FINALIZED:
                    finalized++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case INVALID:
                    invalid++;
                    break;
                case CANCELLED:
                    cancelled++;
                    break;
                default:
                    break;
            }
        }
        return new UploadProgress(tasks.size(), finalized, failed, invalid, cancelled);
    }

    void process(UploadTask task) {
        try {
            if (cancellation.isCancelled()) {
                finish(task, UploadTaskState.CANCELLED, UploadErrors.cancelled());
                return;
            }

            // 1. Validierung
            advance(task, UploadTaskState.VALIDATING);
            FileValidationResult validation = fileValidator.validate(task.toCandidate());
            if (!validation.isValid()) {
                statusListener.onStatus(validation.getMessage(), StatusKind.ERROR);
                finish(task, UploadTaskState.INVALID, UploadError.builder()
                        .message(validation.getMessage())
                        .errorCode(validation.getErrorCode())
                        .blocking("not")
                        .build());
                return;
            }

            // 2. Typabhängige Transformation
            UploadRoute route = uploadTypes.resolve(task.getUploadType());
            if (!(route.getStrategy() instanceof DefaultUploadStrategy)) {
                advance(task, UploadTaskState.TRANSFORMING);
            }

            // 3. Übertragung
            if (cancellation.isCancelled() || !advance(task, UploadTaskState.TRANSMITTING)) {
                finish(task, UploadTaskState.CANCELLED, UploadErrors.cancelled());
                return;
            }
            TransportResult result = transmit(task, route);
            task.recordAttempts(result.getAttempts(), settings.getMaxRetries());

            if (cancellation.isCancelled() || result.isCancelled()) {
                finish(task, UploadTaskState.CANCELLED, UploadErrors.cancelled());
                return;
            }
            if (!result.isSuccess()) {
                statusListener.onStatus(task.getFileName() + ": " + result.getError().getMessage(), StatusKind.ERROR);
                finish(task, UploadTaskState.FAILED, result.getError());
                return;
            }

            // 4. Scan abwarten oder direkt abschließen
            ServerReply reply = readReply(result.getResponse());
            task.recordServerMessage(reply.message);
            if (!settings.isScanEnabled() || reply.scanDisabled) {
                statusListener.onStatus(task.getFileName() + ": upload completed", StatusKind.SUCCESS);
                finish(task, UploadTaskState.FINALIZED, null);
                return;
            }
            awaitScan(task);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing {}", task.getFileName(), e);
            finish(task, UploadTaskState.FAILED, UploadErrors.handlerError(e.getMessage()));
        }
    }

    private TransportResult transmit(UploadTask task, UploadRoute route) {
        UploadPayload payload = UploadPayload.builder()
                .fileName(task.getFileName())
                .mimeType(task.getMimeType())
                .content(task.getContent())
                .uploadType(route.getUploadType())
                .csrfToken(settings.getCsrfToken())
                .field("index", String.valueOf(tasks.indexOf(task)))
                .build();
        String endpoint = settings.getBaseUrl() == null ? route.getPath() : settings.getBaseUrl() + route.getPath();
        try {
            return route.getStrategy().upload(transport, endpoint, payload, cancellation);
        } catch (RuntimeException e) {
            log.error("Upload handler for {} failed", route.getUploadType(), e);
            return TransportResult.failure(UploadErrors.handlerError(e.getMessage()), null, 1);
        }
    }

    private void awaitScan(UploadTask task) {
        if (!advance(task, UploadTaskState.AWAITING_SCAN)) {
            return;
        }
        statusListener.onStatus(task.getFileName() + ": waiting for virus scan", StatusKind.INFO);

        Consumer<UploadTask> early = earlyScanResults.remove(task.getFileName());
        if (early != null) {
            early.accept(task);
            return;
        }

        ScheduledFuture<?> timeout = scheduler.schedule(() -> {
            if (task.getState() == UploadTaskState.AWAITING_SCAN) {
                log.warn("No scan result for {} within {}", task.getFileName(), settings.getScanTimeout());
                applyScanError(task, "Virus scan timed out");
            }
        }, settings.getScanTimeout().toMillis(), TimeUnit.MILLISECONDS);
        scanTimeouts.put(task.getId(), timeout);
    }

    // --- ScanEventSink ---

    @Override
    public void onScanClean(String fileName, String message) {
        applyScanResult(fileName, task -> finish(task, UploadTaskState.FINALIZED, null));
    }

    @Override
    public void onScanInfected(String fileName, String message) {
        UploadError error = UploadError.builder()
                .message(message)
                .errorCode("VIRUS_FOUND")
                .state("virusScan")
                .blocking("blocking")
                .build();
        applyScanResult(fileName, task -> finish(task, UploadTaskState.FAILED, error));
    }

    @Override
    public void onScanError(String fileName, String message) {
        applyScanResult(fileName, task -> applyScanError(task, message));
    }

    @Override
    public void onUploadFailed(String fileName, String message) {
        UploadError error = UploadError.builder()
                .message(message)
                .errorCode("ERROR_DURING_FILE_UPLOAD")
                .blocking("blocking")
                .build();
        applyScanResult(fileName, task -> finish(task, UploadTaskState.FAILED, error));
    }

    private void applyScanResult(String fileName, Consumer<UploadTask> outcome) {
        AtomicInteger matched = new AtomicInteger();
        for (UploadTask task : tasks) {
            if (fileName != null && !fileName.equals(task.getFileName())) {
                continue;
            }
            UploadTaskState state = task.getState();
            if (state == UploadTaskState.AWAITING_SCAN) {
                outcome.accept(task);
                matched.incrementAndGet();
            } else if (state == UploadTaskState.TRANSMITTING && fileName != null) {
                earlyScanResults.put(fileName, outcome);
                matched.incrementAndGet();
                // Übertragung inzwischen abgeschlossen: selbst anwenden
                if (task.getState() == UploadTaskState.AWAITING_SCAN && earlyScanResults.remove(fileName, outcome)) {
                    outcome.accept(task);
                }
            }
        }
        if (matched.get() == 0) {
            log.debug("Scan event for {} matched no waiting upload", fileName == null ? "all files" : fileName);
        }
    }

    private void applyScanError(UploadTask task, String message) {
        if (settings.requireScanErrorPolicy() == ScanErrorPolicy.CONTINUE) {
            statusListener.onStatus(task.getFileName() + ": scan failed, upload kept", StatusKind.WARNING);
            finish(task, UploadTaskState.FINALIZED, null);
        } else {
            statusListener.onStatus(task.getFileName() + ": scan failed, upload stopped", StatusKind.ERROR);
            finish(task, UploadTaskState.FAILED, UploadError.builder()
                    .message(message)
                    .errorCode("SCAN_ERROR")
                    .state("virusScan")
                    .blocking("blocking")
                    .build());
        }
    }

    // --- Zustandsübergänge ---

    private boolean advance(UploadTask task, UploadTaskState next) {
        UploadTaskState from = task.getState();
        if (!task.transitionTo(next)) {
            return false;
        }
        statusListener.onTaskStateChanged(task, from, next);
        return true;
    }

    private void finish(UploadTask task, UploadTaskState terminal, UploadError error) {
        UploadTaskState from = task.getState();
        if (!task.transitionTo(terminal)) {
            return;
        }
        if (error != null) {
            task.recordError(error);
        }
        earlyScanResults.remove(task.getFileName());
        ScheduledFuture<?> timeout = scanTimeouts.remove(task.getId());
        if (timeout != null) {
            timeout.cancel(false);
        }
        statusListener.onTaskStateChanged(task, from, terminal);
        statusListener.onProgress(getProgress());
        CompletableFuture<UploadTaskState> completion = completions.get(task.getId());
        if (completion != null) {
            completion.complete(terminal);
        }
    }

    private CompletableFuture<Void> allOf(List<UploadTask> batch) {
        return CompletableFuture.allOf(batch.stream()
                .map(task -> completions.get(task.getId()))
                .toArray(CompletableFuture[]::new));
    }

    private ServerReply readReply(HttpUploadResponse response) {
        if (response == null || !response.isJson() || response.getBody() == null) {
            return new ServerReply(null, false);
        }
        try {
            JsonNode node = transport.getObjectMapper().readTree(response.getBody());
            return new ServerReply(node.path("message").asText(null), node.path("scanDisabled").asBoolean(false));
        } catch (IOException e) {
            return new ServerReply(null, false);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ServerReply {
        private final String message;
        private final boolean scanDisabled;

        private ServerReply(String message, boolean scanDisabled) {
            this.message = message;
            this.scanDisabled = scanDisabled;
        }
    }
}
