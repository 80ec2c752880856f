package de.jwiegmann.ultraupload.control.error;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prozessweites Verzeichnis der Fehlerdefinitionen.
 * Statische Definitionen stammen aus "ultra.errors.definitions", Laufzeitdefinitionen
 * aus {@link #define(String, ErrorConfig)} und haben Vorrang.
 */
@Component
public class ErrorConfigRegistry {

    private final Map<String, ErrorConfig> staticConfigs;
    private final Map<String, ErrorConfig> runtimeConfigs = new ConcurrentHashMap<>();
    private final ErrorConfig fallbackError;

    @Autowired
    public ErrorConfigRegistry(ErrorManagerProperties properties) {
        this(properties.getDefinitions(), properties.getFallbackError());
    }

    public ErrorConfigRegistry(Map<String, ErrorConfig> staticConfigs, ErrorConfig fallbackError) {
        this.staticConfigs = staticConfigs == null ? Map.of() : new LinkedHashMap<>(staticConfigs);
        this.fallbackError = fallbackError;
    }

    /**
     * Registriert oder überschreibt einen Code. Die Konfiguration wird kopiert,
     * spätere Änderungen am übergebenen Objekt wirken sich nicht aus.
     */
    public void define(String errorCode, ErrorConfig config) {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("Error code must not be blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("Error config must not be null for " + errorCode);
        }
        runtimeConfigs.put(errorCode, config.toBuilder().build());
    }

    public Optional<ErrorConfig> find(String errorCode) {
        if (errorCode == null) {
            return Optional.empty();
        }
        ErrorConfig runtime = runtimeConfigs.get(errorCode);
        if (runtime != null) {
            return Optional.of(runtime);
        }
        return Optional.ofNullable(staticConfigs.get(errorCode));
    }

    public Optional<ErrorConfig> fallbackError() {
        return Optional.ofNullable(fallbackError);
    }

    public boolean isDefined(String errorCode) {
        return find(errorCode).isPresent();
    }

    /**
     * Alle bekannten Codes, sortiert. Laufzeitdefinitionen eingeschlossen.
     */
    public Set<String> knownCodes() {
        Set<String> codes = new TreeSet<>(staticConfigs.keySet());
        codes.addAll(runtimeConfigs.keySet());
        return codes;
    }
}
