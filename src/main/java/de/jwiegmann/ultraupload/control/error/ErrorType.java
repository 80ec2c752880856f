package de.jwiegmann.ultraupload.control.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorType {
    CRITICAL,
    ERROR,
    WARNING,
    NOTICE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
