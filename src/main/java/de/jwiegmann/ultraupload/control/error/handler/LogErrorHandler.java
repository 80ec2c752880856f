package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import de.jwiegmann.ultraupload.control.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

import java.util.Map;

/**
 * Protokolliert jeden Fehler mit einem vom Fehlertyp abhängigen Level.
 */
@Slf4j(topic = "ultra.errors")
@RequiredArgsConstructor
public class LogErrorHandler implements ErrorHandler {

    private final ErrorMessageFormatter formatter;

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        return true;
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        String message = formatter.developerMessage(config, context);
        String prefix = config.resolvedType() == ErrorType.CRITICAL
                ? "CRITICAL " : "";
        log.atLevel(levelFor(config))
                .setCause(exception)
                .log("{}[{}] {} context={}", prefix, errorCode, message, context);
    }

    static Level levelFor(ErrorConfig config) {
        switch (config.resolvedType()) {
            case WARNING:
                return Level.WARN;
            case NOTICE:
                return Level.INFO;
            case CRITICAL:
            case ERROR:
            default:
                return Level.ERROR;
        }
    }
}
