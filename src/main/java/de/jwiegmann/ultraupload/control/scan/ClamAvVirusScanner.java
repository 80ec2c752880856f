package de.jwiegmann.ultraupload.control.scan;

import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ruft das clamscan-Binary auf. Exit-Code 0 = sauber, 1 = infiziert, sonst Fehler.
 */
@Slf4j(topic = "ultra.upload")
public class ClamAvVirusScanner implements VirusScanner {

    private static final long OUTPUT_GRACE_SECONDS = 5;

    private final UltraUploadProperties.Scan settings;

    public ClamAvVirusScanner(UltraUploadProperties.Scan settings) {
        this.settings = settings;
    }

    @Override
    public ScanResult scan(Path file) {
        List<String> command = new ArrayList<>();
        command.add(settings.getBinary());
        command.addAll(settings.getOptions());
        command.add(file.toAbsolutePath().toString());

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            log.error("Could not start virus scanner {}: {}", settings.getBinary(), e.getMessage());
            return ScanResult.error("scanner not available: " + e.getMessage());
        }

        // Ausgabe parallel lesen, sonst blockiert clamscan bei vollem Pipe-Puffer
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process.getInputStream()));
        try {
            boolean finished = process.waitFor(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Virus scan of {} timed out after {}", file.getFileName(), settings.getTimeout());
                return ScanResult.error("scan timed out after " + settings.getTimeout());
            }
            return evaluate(file, process.exitValue(), output.get(OUTPUT_GRACE_SECONDS, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ScanResult.error("scan interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not read scanner output for {}: {}", file.getFileName(), e.getMessage());
            return evaluate(file, process.exitValue(), "");
        }
    }

    private static ScanResult evaluate(Path file, int exitCode, String output) {
        log.debug("clamscan exit code {} for {}: {}", exitCode, file.getFileName(), output);

        switch (exitCode) {
            case 0:
                return ScanResult.clean();
            case 1:
                return ScanResult.infected(output);
            default:
                return ScanResult.error("clamscan exit code " + exitCode + ": " + output);
        }
    }

    private static String readOutput(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            return "";
        }
    }
}
