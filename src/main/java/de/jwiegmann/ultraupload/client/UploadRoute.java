package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.client.transport.UploadTypeStrategy;
import lombok.Value;

@Value
public class UploadRoute {
    String uploadType;
    String path;
    UploadTypeStrategy strategy;
}
