package de.jwiegmann.ultraupload.control.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Prüft eine Datei gegen die Upload-Policy, bevor irgendein Netzwerkaufruf erfolgt.
 * Reihenfolge: Endung, MIME-Typ, Größe, Dateiname. Der erste Fehler beendet die Prüfung.
 * Keine I/O, nur Metadaten und die injizierte Policy.
 * Der Server wendet dieselbe Prüfung auf eingehende Dateien erneut an.
 */
public class ClientFileValidator {

    public static final String INVALID_FILE_EXTENSION = "INVALID_FILE_EXTENSION";
    public static final String MIME_TYPE_NOT_ALLOWED = "MIME_TYPE_NOT_ALLOWED";
    public static final String MAX_FILE_SIZE = "MAX_FILE_SIZE";
    public static final String INVALID_FILE_NAME = "INVALID_FILE_NAME";

    private static final Pattern FILE_NAME = Pattern.compile("^[A-Za-z0-9_\\-. ]+$");

    private final FilePolicy policy;

    public ClientFileValidator(FilePolicy policy) {
        this.policy = policy;
    }

    public FileValidationResult validate(FileCandidate file) {

        // 1. Endung
        String extension = extensionOf(file.getName());
        boolean extensionAllowed = policy.getAllowedExtensions().stream()
                .anyMatch(allowed -> allowed.equalsIgnoreCase(extension));
        if (!extensionAllowed) {
            String message = policy.messageTemplate(FilePolicy.MSG_EXTENSION)
                    .replace(":extensions", String.join(", ", policy.getAllowedExtensions()))
                    .replace(":extension", extension);
            return FileValidationResult.invalid(INVALID_FILE_EXTENSION, message);
        }

        // 2. MIME-Typ
        String mimeType = file.getMimeType() == null ? "" : file.getMimeType();
        if (!policy.getAllowedMimeTypes().contains(mimeType)) {
            String message = policy.messageTemplate(FilePolicy.MSG_MIME_TYPE)
                    .replace(":mimetypes", String.join(", ", policy.getAllowedMimeTypes()))
                    .replace(":type", mimeType);
            return FileValidationResult.invalid(MIME_TYPE_NOT_ALLOWED, message);
        }

        // 3. Größe
        if (file.getSize() > policy.getMaxSize()) {
            String maxMegabytes = BigDecimal.valueOf(policy.getMaxSize())
                    .divide(BigDecimal.valueOf(1024L * 1024L), 2, RoundingMode.HALF_UP)
                    .toPlainString();
            String message = policy.messageTemplate(FilePolicy.MSG_SIZE)
                    .replace(":size", maxMegabytes);
            return FileValidationResult.invalid(MAX_FILE_SIZE, message);
        }

        // 4. Dateiname
        if (file.getName() == null || !FILE_NAME.matcher(file.getName()).matches()) {
            String message = policy.messageTemplate(FilePolicy.MSG_FILENAME)
                    .replace(":filename", String.valueOf(file.getName()));
            return FileValidationResult.invalid(INVALID_FILE_NAME, message);
        }

        return FileValidationResult.valid();
    }

    /**
     * Endung nach dem letzten Punkt, kleingeschrieben. Ohne Punkt leer.
     */
    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
