package de.jwiegmann.ultraupload.control.limits;

import lombok.Builder;
import lombok.Value;

/**
 * Effektive, ausgehandelte Upload-Grenzen. Pro Dimension gilt min(Plattform, Anwendung).
 */
@Value
@Builder
public class UploadLimits {
    LimitValue maxTotalSize;
    LimitValue maxFileSize;
    LimitValue maxFiles;
}
