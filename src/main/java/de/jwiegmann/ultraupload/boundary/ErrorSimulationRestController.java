package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorConfigRegistry;
import de.jwiegmann.ultraupload.control.error.ErrorType;
import de.jwiegmann.ultraupload.control.simulation.TestingConditions;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fehlersimulation für Tests. Alle Routen außer /codes sind per
 * {@link EnvironmentGuardInterceptor} auf Nicht-Produktionsumgebungen beschränkt.
 */
@RestController
@RequestMapping("/api/errors")
public class ErrorSimulationRestController {

    private final TestingConditions testingConditions;
    private final ErrorConfigRegistry registry;

    public ErrorSimulationRestController(TestingConditions testingConditions, ErrorConfigRegistry registry) {
        this.testingConditions = testingConditions;
        this.registry = registry;
    }

    /**
     * POST /api/errors/simulate/{errorCode}
     */
    @PostMapping("/simulate/{errorCode}")
    public ResponseEntity<Map<String, Object>> activate(@PathVariable String errorCode) {
        if (!registry.isDefined(errorCode)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "success", false,
                    "message", "Error code " + errorCode + " does not exist"));
        }
        testingConditions.setCondition(errorCode, true);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Simulation activated for " + errorCode,
                "errorCode", errorCode));
    }

    /**
     * DELETE /api/errors/simulate/{errorCode}
     */
    @DeleteMapping("/simulate/{errorCode}")
    public ResponseEntity<Map<String, Object>> deactivate(@PathVariable String errorCode) {
        testingConditions.setCondition(errorCode, false);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Simulation deactivated for " + errorCode,
                "errorCode", errorCode));
    }

    /**
     * GET /api/errors/simulations
     */
    @GetMapping("/simulations")
    public ResponseEntity<Map<String, Object>> activeSimulations() {
        Map<String, Boolean> active = testingConditions.getActiveConditions();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "activeSimulations", active,
                "count", active.size()));
    }

    /**
     * POST /api/errors/simulations/reset
     */
    @PostMapping("/simulations/reset")
    public ResponseEntity<Map<String, Object>> reset() {
        testingConditions.reset();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "All simulations have been reset"));
    }

    /**
     * GET /api/errors/codes?type=critical: alle bekannten Codes, optional nach Typ gefiltert
     */
    @GetMapping("/codes")
    public ResponseEntity<Map<String, Object>> codes(@RequestParam(value = "type", required = false) String type) {
        Optional<ErrorType> filter = parseType(type);
        Map<String, Object> codes = new LinkedHashMap<>();
        for (String code : registry.knownCodes()) {
            ErrorConfig config = registry.find(code).orElseThrow();
            if (filter.isEmpty() || filter.get() == config.resolvedType()) {
                codes.put(code, describe(config));
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("errorCodes", codes);
        body.put("count", codes.size());
        body.put("filter", type);
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> describe(ErrorConfig config) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", config.resolvedType().value());
        description.put("blocking", config.resolvedBlocking().value());
        description.put("http_status_code", config.resolvedHttpStatusCode());
        description.put("msg_to", config.getMsgTo());
        return description;
    }

    private static Optional<ErrorType> parseType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        String normalized = type.toLowerCase(Locale.ROOT);
        for (ErrorType candidate : ErrorType.values()) {
            if (candidate.value().equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unknown error type " + type);
    }
}
