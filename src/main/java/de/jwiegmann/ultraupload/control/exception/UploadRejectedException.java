package de.jwiegmann.ultraupload.control.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Ein eingehender Upload wurde abgelehnt. Der Fehlercode wird anschließend
 * über den ErrorManager aufgelöst.
 */
@Getter
public class UploadRejectedException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    public UploadRejectedException(String errorCode, Map<String, Object> context) {
        this(errorCode, context, null);
    }

    public UploadRejectedException(String errorCode, Map<String, Object> context, Throwable cause) {
        super(errorCode, cause);
        this.errorCode = errorCode;
        this.context = context;
    }
}
