package de.jwiegmann.ultraupload.control.error;

import lombok.Value;

@Value
public class ExceptionSummary {
    String className;
    String message;

    public static ExceptionSummary of(Throwable throwable) {
        return throwable == null ? null
                : new ExceptionSummary(throwable.getClass().getName(), throwable.getMessage());
    }
}
