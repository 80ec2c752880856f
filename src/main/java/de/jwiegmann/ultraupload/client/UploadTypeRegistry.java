package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.client.transport.DefaultUploadStrategy;
import de.jwiegmann.ultraupload.client.transport.EppUploadStrategy;
import de.jwiegmann.ultraupload.client.transport.UploadTypeStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordnet Upload-Typen einen Endpunkt und eine Strategie zu.
 * Unbekannte Typen laufen über den Default-Typ und /uploading/default.
 */
@Slf4j(topic = "ultra.upload")
public class UploadTypeRegistry {

    public static final String DEFAULT_PATH = "/uploading/default";

    private final Map<String, String> paths;
    private final String defaultType;
    private final Map<String, UploadTypeStrategy> strategies = new HashMap<>();
    private final UploadTypeStrategy defaultStrategy = new DefaultUploadStrategy();

    public UploadTypeRegistry(Map<String, String> paths, String defaultType) {
        this.paths = paths == null ? Map.of() : new LinkedHashMap<>(paths);
        this.defaultType = defaultType == null ? "default" : defaultType;
        strategies.put(EppUploadStrategy.UPLOAD_TYPE, new EppUploadStrategy());
    }

    public UploadTypeRegistry register(String uploadType, UploadTypeStrategy strategy) {
        strategies.put(uploadType, strategy);
        return this;
    }

    public UploadRoute resolve(String uploadType) {
        String path = uploadType == null ? null : paths.get(uploadType);
        if (path == null) {
            log.info("Unknown upload type '{}', using default type {}", uploadType, defaultType);
            return new UploadRoute(defaultType, paths.getOrDefault(defaultType, DEFAULT_PATH), defaultStrategy);
        }
        return new UploadRoute(uploadType, path, strategies.getOrDefault(uploadType, defaultStrategy));
    }

    public String getDefaultType() {
        return defaultType;
    }
}
