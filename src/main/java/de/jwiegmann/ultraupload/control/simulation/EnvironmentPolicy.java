package de.jwiegmann.ultraupload.control.simulation;

import de.jwiegmann.ultraupload.config.EnvironmentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Entscheidet anhand von "ultra.environment", welche Test- und Simulationsfunktionen aktiv sind.
 */
@Component
@RequiredArgsConstructor
public class EnvironmentPolicy {

    public static final String PRODUCTION = "production";

    private static final Set<String> SIMULATION_ENVIRONMENTS = Set.of("local", "development", "testing", "staging");

    private final EnvironmentProperties properties;

    public String currentEnvironment() {
        String environment = properties.getEnvironment();
        return environment == null ? PRODUCTION : environment.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isProduction() {
        return PRODUCTION.equals(currentEnvironment());
    }

    public boolean isSimulationAllowed() {
        return SIMULATION_ENVIRONMENTS.contains(currentEnvironment());
    }
}
