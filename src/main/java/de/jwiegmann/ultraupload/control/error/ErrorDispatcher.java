package de.jwiegmann.ultraupload.control.error;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Ruft die registrierten Handler in Reihenfolge auf. Ein fehlschlagender Handler
 * wird protokolliert und hält die übrigen nicht auf.
 */
@Slf4j(topic = "ultra.errors")
public class ErrorDispatcher {

    private final List<ErrorHandler> handlers;

    public ErrorDispatcher(List<ErrorHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    public void dispatch(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        for (ErrorHandler handler : handlers) {
            String handlerName = handler.getClass().getSimpleName();
            try {
                if (handler.shouldHandle(config)) {
                    handler.handle(errorCode, config, context, exception);
                }
            } catch (RuntimeException e) {
                log.error("Error handler {} failed while handling {}: {}", handlerName, errorCode, e.getMessage(), e);
            }
        }
    }

    public List<ErrorHandler> getHandlers() {
        return handlers;
    }
}
