package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.boundary.dto.UploadLimitsResponse;
import de.jwiegmann.ultraupload.control.limits.SizeFormatter;
import de.jwiegmann.ultraupload.control.validation.FileCandidate;
import de.jwiegmann.ultraupload.control.validation.FileValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Prüft einen ganzen Batch gegen die ausgehandelten Grenzen, bevor einzelne Dateien validiert werden.
 * Die Gesamtgröße wird mit einem Aufschlag für den Multipart-Overhead gerechnet.
 */
public class UploadLimitsValidator {

    public static final String MAX_FILES = "MAX_FILES";
    public static final String MAX_FILE_SIZE = "MAX_FILE_SIZE";
    public static final String MAX_TOTAL_SIZE = "MAX_TOTAL_SIZE";

    public static final double DEFAULT_SIZE_MARGIN = 1.1;

    private final double sizeMargin;
    private final Map<String, String> translations;

    public UploadLimitsValidator() {
        this(DEFAULT_SIZE_MARGIN, Map.of());
    }

    public UploadLimitsValidator(double sizeMargin, Map<String, String> translations) {
        this.sizeMargin = sizeMargin;
        this.translations = translations == null ? Map.of() : translations;
    }

    public FileValidationResult validate(List<FileCandidate> files, UploadLimitsResponse limits) {
        if (files.size() > limits.getMaxFiles()) {
            String message = template("max_files_error",
                    "You can upload a maximum of :count files at a time.")
                    .replace(":count", String.valueOf(limits.getMaxFiles()));
            return FileValidationResult.invalid(MAX_FILES, message);
        }

        for (FileCandidate file : files) {
            if (file.getSize() > limits.getMaxFileSize()) {
                String message = template("max_file_size_error",
                        "The file \":name\" exceeds the maximum allowed size (:size).")
                        .replace(":name", file.getName())
                        .replace(":size", limits.getMaxFileSizeFormatted());
                return FileValidationResult.invalid(MAX_FILE_SIZE, message);
            }
        }

        long total = files.stream().mapToLong(FileCandidate::getSize).sum();
        long withMargin = Math.round(total * sizeMargin);
        if (withMargin > limits.getMaxTotalSize()) {
            String message = template("max_total_size_error",
                    "The total size of the files (:size) exceeds the allowed limit (:limit).")
                    .replace(":size", SizeFormatter.format(withMargin))
                    .replace(":limit", limits.getMaxTotalSizeFormatted());
            return FileValidationResult.invalid(MAX_TOTAL_SIZE, message);
        }

        return FileValidationResult.valid();
    }

    private String template(String key, String fallback) {
        return translations.getOrDefault(key, fallback);
    }
}
