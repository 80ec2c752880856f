package de.jwiegmann.ultraupload.control.limits;

import lombok.Builder;
import lombok.Value;

/**
 * Unverhandelte Obergrenzen einer einzelnen Quelle (Plattform oder Anwendung).
 */
@Value
@Builder
public class RawLimits {
    long maxTotalSize;
    long maxFileSize;
    int maxFiles;
}
