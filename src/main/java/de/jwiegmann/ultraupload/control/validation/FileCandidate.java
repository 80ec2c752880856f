package de.jwiegmann.ultraupload.control.validation;

import lombok.Value;

/**
 * Metadaten einer Datei, die vor dem Upload geprüft wird.
 */
@Value
public class FileCandidate {
    String name;
    String mimeType;
    long size;
}
