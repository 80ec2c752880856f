package de.jwiegmann.ultraupload.control.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Vom Server gelieferte Regeln für die Dateivalidierung.
 * Meldungsvorlagen enthalten Platzhalter wie :extension, :type, :size, :filename.
 */
@Value
@Builder
public class FilePolicy {

    public static final String MSG_EXTENSION = "invalid_file_extension";
    public static final String MSG_MIME_TYPE = "invalid_mime_type";
    public static final String MSG_SIZE = "max_file_size";
    public static final String MSG_FILENAME = "invalid_file_name";

    private static final Map<String, String> DEFAULT_MESSAGES = Map.of(
            MSG_EXTENSION, "File extension :extension is not allowed. Allowed extensions are: :extensions",
            MSG_MIME_TYPE, "File type :type is not allowed. Allowed types are: :mimetypes",
            MSG_SIZE, "File size exceeds the maximum allowed size of :size MB",
            MSG_FILENAME, "Filename :filename contains invalid characters"
    );

    @Singular
    List<String> allowedExtensions;

    @Singular
    List<String> allowedMimeTypes;

    long maxSize;

    @Singular
    Map<String, String> messages;

    public String messageTemplate(String key) {
        return messages.getOrDefault(key, DEFAULT_MESSAGES.get(key));
    }
}
