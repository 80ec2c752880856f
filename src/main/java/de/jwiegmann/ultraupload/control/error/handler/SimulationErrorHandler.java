package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.simulation.EnvironmentPolicy;
import de.jwiegmann.ultraupload.control.simulation.TestingConditions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Vermerkt außerhalb der Produktion, ob ein Fehler simuliert war.
 */
@Slf4j(topic = "ultra.errors")
@RequiredArgsConstructor
public class SimulationErrorHandler implements ErrorHandler {

    private final EnvironmentPolicy environmentPolicy;
    private final TestingConditions testingConditions;

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        return !environmentPolicy.isProduction();
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        boolean simulated = testingConditions.isTesting(errorCode);
        log.info("Error {} handled in {} (simulated: {}, active simulations: {})",
                errorCode, environmentPolicy.currentEnvironment(), simulated,
                testingConditions.getActiveConditions().keySet());
    }
}
