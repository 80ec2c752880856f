package de.jwiegmann.ultraupload.control.error;

import de.jwiegmann.ultraupload.control.exception.UltraErrorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Einstiegspunkt der Fehlerbehandlung: auflösen, Handler ausführen, Antwort bauen.
 *
 * <p>Der Kern wirft nur im throwMode und bei FATAL_FALLBACK_FAILURE.
 * Blockierende HTML-Fehler werden als {@link ErrorResponse.Kind#BLOCKING} zurückgegeben.</p>
 */
@Slf4j(topic = "ultra.errors")
@Service
@RequiredArgsConstructor
public class ErrorManager {

    private final ErrorConfigRegistry registry;
    private final ErrorConfigResolver resolver;
    private final ErrorDispatcher dispatcher;
    private final ErrorInfoFactory infoFactory;
    private final ErrorResponseBuilder responseBuilder;

    public ErrorResponse handle(String errorCode, Map<String, Object> context, Throwable exception, RequestShape request) {
        ErrorInfo info = process(errorCode, context, exception);
        return responseBuilder.build(info, request);
    }

    /**
     * Wie {@link #handle(String, Map, Throwable, RequestShape)}, wirft aber nach dem
     * Dispatch immer eine {@link UltraErrorException} mit dem aufgelösten Code.
     */
    public ErrorResponse handle(String errorCode, Map<String, Object> context, Throwable exception,
                                RequestShape request, boolean throwMode) {
        if (!throwMode) {
            return handle(errorCode, context, exception, request);
        }
        ErrorInfo info = process(errorCode, context, exception);
        throw new UltraErrorException(info.getMessage(), info.getHttpStatusCode(), exception,
                info.getErrorCode(), info.getContext());
    }

    public void defineError(String errorCode, ErrorConfig config) {
        registry.define(errorCode, config);
        log.debug("Runtime error definition registered for {}", errorCode);
    }

    public Optional<ErrorConfig> getErrorConfig(String errorCode) {
        return registry.find(errorCode);
    }

    private ErrorInfo process(String errorCode, Map<String, Object> context, Throwable exception) {
        Map<String, Object> workingContext = context == null ? new HashMap<>() : new HashMap<>(context);
        ResolvedError resolved = resolver.resolve(errorCode, workingContext);
        dispatcher.dispatch(resolved.getCode(), resolved.getConfig(), workingContext, exception);
        return infoFactory.create(resolved.getCode(), resolved.getConfig(), workingContext, exception);
    }
}
