package de.jwiegmann.ultraupload.control.error;

import lombok.Value;

@Value
public class ResolvedError {
    String code;
    ErrorConfig config;
}
