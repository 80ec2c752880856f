package de.jwiegmann.ultraupload.control.error;

import de.jwiegmann.ultraupload.control.exception.UltraErrorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Löst einen Fehlercode über die dreistufige Rückfallkette auf:
 * Code selbst, UNDEFINED_ERROR_CODE, fallback_error.
 */
@Slf4j(topic = "ultra.errors")
@Component
@RequiredArgsConstructor
public class ErrorConfigResolver {

    public static final String UNDEFINED_ERROR_CODE = "UNDEFINED_ERROR_CODE";
    public static final String FALLBACK_ERROR = "FALLBACK_ERROR";
    public static final String ORIGINAL_CODE_KEY = "_original_code";

    private final ErrorConfigRegistry registry;

    /**
     * @param context wird bei Rückfall um {@code _original_code} ergänzt, muss also veränderbar sein
     * @throws UltraErrorException mit FATAL_FALLBACK_FAILURE, wenn keine Stufe greift
     */
    public ResolvedError resolve(String errorCode, Map<String, Object> context) {
        Optional<ErrorConfig> direct = registry.find(errorCode);
        if (direct.isPresent()) {
            return new ResolvedError(errorCode, direct.get());
        }

        log.warn("Undefined error code '{}', falling back to {}", errorCode, UNDEFINED_ERROR_CODE);
        context.put(ORIGINAL_CODE_KEY, errorCode);

        Optional<ErrorConfig> undefined = registry.find(UNDEFINED_ERROR_CODE);
        if (undefined.isPresent()) {
            return new ResolvedError(UNDEFINED_ERROR_CODE, undefined.get());
        }

        Optional<ErrorConfig> fallback = registry.fallbackError();
        if (fallback.isPresent()) {
            log.error("{} not configured, using fallback_error for '{}'", UNDEFINED_ERROR_CODE, errorCode);
            return new ResolvedError(FALLBACK_ERROR, fallback.get());
        }

        // direkt konstruiert, darf nicht erneut durch resolve() laufen
        log.error("CRITICAL: no configuration for '{}', {} or fallback_error", errorCode, UNDEFINED_ERROR_CODE);
        throw new UltraErrorException(
                "Fatal error: no fallback configuration available for " + errorCode,
                500,
                null,
                UltraErrorException.FATAL_FALLBACK_FAILURE,
                context);
    }
}
