package de.jwiegmann.ultraupload.control;

import de.jwiegmann.ultraupload.boundary.dto.UploadReceiptResponse;
import de.jwiegmann.ultraupload.config.UltraUploadProperties;
import de.jwiegmann.ultraupload.control.exception.UploadRejectedException;
import de.jwiegmann.ultraupload.control.repository.InMemoryStoredFileRepository;
import de.jwiegmann.ultraupload.control.scan.VirusScanService;
import de.jwiegmann.ultraupload.control.simulation.TestingConditions;
import de.jwiegmann.ultraupload.control.validation.ClientFileValidator;
import de.jwiegmann.ultraupload.control.validation.FileCandidate;
import de.jwiegmann.ultraupload.control.validation.FileValidationResult;
import de.jwiegmann.ultraupload.entity.StoredFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Nimmt hochgeladene Dateien entgegen: prüfen, speichern, Metadaten ablegen, Scan anstoßen.
 */
@Slf4j(topic = "ultra.upload")
@Service
public class UploadReceiptService {

    public static final String EPP = "epp";
    public static final String VERIFICATION_TOKEN_VALID = "VALID";

    private final ClientFileValidator fileValidator;
    private final InMemoryStoredFileRepository fileRepository;
    private final VirusScanService virusScanService;
    private final TestingConditions testingConditions;
    private final UltraUploadProperties properties;

    public UploadReceiptService(ClientFileValidator fileValidator,
                                InMemoryStoredFileRepository fileRepository,
                                VirusScanService virusScanService,
                                TestingConditions testingConditions,
                                UltraUploadProperties properties) {
        this.fileValidator = fileValidator;
        this.fileRepository = fileRepository;
        this.virusScanService = virusScanService;
        this.testingConditions = testingConditions;
        this.properties = properties;
    }

    /**
     * Verarbeitet eine einzelne Datei eines Uploads.
     *
     * @param uploadType Upload-Typ aus dem Pfad, z.B. egi oder epp
     * @param file       Multipart-Datei aus dem Feld "file"
     * @param index      Position der Datei im Batch, "0" für die erste
     * @return Empfangsbestätigung
     * @throws UploadRejectedException mit dem aufzulösenden Fehlercode
     */
    public UploadReceiptResponse receive(String uploadType, MultipartFile file, String index) {

        // 1. Datei vorhanden?
        if (file == null || file.isEmpty()) {
            throw new UploadRejectedException("INVALID_FILE", Map.of("fileName", "unknown"));
        }
        String fileName = file.getOriginalFilename() == null ? "unknown" : file.getOriginalFilename();
        log.info("Receiving {} upload: {} ({} bytes)", uploadType, fileName, file.getSize());

        // 2. Simulierte Fehler nur für die erste Datei
        if ("0".equals(index)) {
            if (testingConditions.isTesting("FILE_NOT_FOUND")) {
                throw new UploadRejectedException("FILE_NOT_FOUND", Map.of("fileName", fileName));
            }
            if (testingConditions.isTesting("GENERIC_SERVER_ERROR")) {
                throw new UploadRejectedException("GENERIC_SERVER_ERROR", Map.of("fileName", fileName));
            }
        }

        // 3. Inhalt lesen, bei epp Base64 dekodieren
        byte[] content = readContent(uploadType, file, fileName);

        // 4. Dieselbe Prüfung wie im Client
        FileValidationResult validation = fileValidator.validate(
                new FileCandidate(fileName, file.getContentType(), content.length));
        if (!validation.isValid()) {
            Map<String, Object> context = new HashMap<>();
            context.put("fileName", fileName);
            context.put("message", validation.getMessage());
            throw new UploadRejectedException(validation.getErrorCode(), context);
        }

        // 5. Speichern und Metadaten ablegen
        StoredFile stored = store(uploadType, fileName, file.getContentType(), content);

        // 6. Scan anstoßen
        virusScanService.scanAsync(stored);

        UploadReceiptResponse.UploadReceiptResponseBuilder response = UploadReceiptResponse.builder()
                .fileName(fileName)
                .fileId(stored.getId())
                .hash(stored.getHash());
        if (virusScanService.isEnabled()) {
            response.message("Upload completed, starting virus scan...");
        } else {
            response.message("Upload completed, virus scan disabled.").scanDisabled(true);
        }
        if (EPP.equals(uploadType)) {
            response.verificationToken(VERIFICATION_TOKEN_VALID);
        }
        return response.build();
    }

    private byte[] readContent(String uploadType, MultipartFile file, String fileName) {
        try {
            byte[] raw = file.getBytes();
            if (!EPP.equals(uploadType)) {
                return raw;
            }
            return Base64.getMimeDecoder().decode(raw);
        } catch (IllegalArgumentException e) {
            throw new UploadRejectedException("INVALID_FILE", Map.of("fileName", fileName), e);
        } catch (IOException e) {
            throw new UploadRejectedException("ERROR_DURING_FILE_UPLOAD", Map.of("fileName", fileName), e);
        }
    }

    private StoredFile store(String uploadType, String fileName, String mimeType, byte[] content) {
        String id = UUID.randomUUID().toString();
        String extension = extensionOf(fileName);
        Path directory = Paths.get(properties.getStoragePath(), uploadType);
        Path target = directory.resolve(extension.isEmpty() ? id : id + "." + extension);

        try {
            Files.createDirectories(directory);
            Files.write(target, content);
        } catch (IOException e) {
            log.error("Could not store {} at {}: {}", fileName, target, e.getMessage());
            throw new UploadRejectedException("IMPOSSIBLE_SAVE_FILE",
                    Map.of("fileName", fileName, "directory", directory.toString()), e);
        }

        LocalDateTime now = LocalDateTime.now();
        StoredFile stored = StoredFile.builder()
                .id(id)
                .uploadType(uploadType)
                .originalName(fileName)
                .extension(extension)
                .mimeType(mimeType)
                .size(content.length)
                .hash(DigestUtils.md5DigestAsHex(content))
                .storedPath(target)
                .scanStatus(StoredFile.ScanStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return fileRepository.save(stored);
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
