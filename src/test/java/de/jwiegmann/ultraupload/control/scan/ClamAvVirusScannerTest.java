package de.jwiegmann.ultraupload.control.scan;

import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ClamAvVirusScannerTest {

    @TempDir
    Path tempDir;

    private ScanResult scanWith(String script, Duration timeout) throws Exception {
        Path file = Files.writeString(tempDir.resolve("upload.txt"), "content");
        UltraUploadProperties.Scan settings = new UltraUploadProperties.Scan();
        settings.setBinary("sh");
        // Dateipfad landet als $0 hinter dem Skript
        settings.setOptions(List.of("-c", script));
        settings.setTimeout(timeout);
        return new ClamAvVirusScanner(settings).scan(file);
    }

    @Test
    void exit_code_zero_is_clean() throws Exception {
        ScanResult result = scanWith("exit 0", Duration.ofSeconds(10));

        assertThat(result.getVerdict()).isEqualTo(ScanResult.Verdict.CLEAN);
    }

    @Test
    void output_larger_than_pipe_buffer_does_not_block_the_scan() throws Exception {
        // 1) Scanner schreibt 256 KB und meldet "infiziert"
        String script = "head -c 262144 /dev/zero | tr '\\0' 'a'; exit 1";

        // 2) Scannen
        ScanResult result = scanWith(script, Duration.ofSeconds(10));

        // 3) Kein Timeout, vollständige Ausgabe
        assertThat(result.getVerdict()).isEqualTo(ScanResult.Verdict.INFECTED);
        assertThat(result.getDetails()).hasSize(262144);
    }

    @Test
    void other_exit_codes_are_scan_errors() throws Exception {
        ScanResult result = scanWith("echo broken; exit 2", Duration.ofSeconds(10));

        assertThat(result.getVerdict()).isEqualTo(ScanResult.Verdict.ERROR);
        assertThat(result.getDetails()).isEqualTo("clamscan exit code 2: broken");
    }

    @Test
    void missing_binary_is_a_scan_error() throws Exception {
        Path file = Files.writeString(tempDir.resolve("upload.txt"), "content");
        UltraUploadProperties.Scan settings = new UltraUploadProperties.Scan();
        settings.setBinary("definitely-not-a-scanner-binary");

        ScanResult result = new ClamAvVirusScanner(settings).scan(file);

        assertThat(result.getVerdict()).isEqualTo(ScanResult.Verdict.ERROR);
        assertThat(result.getDetails()).startsWith("scanner not available");
    }
}
