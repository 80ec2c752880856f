package de.jwiegmann.ultraupload.control.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FileValidationResult {

    private boolean valid;
    private String errorCode;
    private String message;

    public static FileValidationResult valid() {
        return new FileValidationResult(true, null, null);
    }

    public static FileValidationResult invalid(String errorCode, String message) {
        return new FileValidationResult(false, errorCode, message);
    }
}
