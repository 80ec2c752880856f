package de.jwiegmann.ultraupload.control.error.handler;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import de.jwiegmann.ultraupload.control.error.ContextSanitizer;
import de.jwiegmann.ultraupload.control.error.ErrorConfig;
import de.jwiegmann.ultraupload.control.error.ErrorHandler;
import de.jwiegmann.ultraupload.control.error.ErrorMessageFormatter;
import de.jwiegmann.ultraupload.control.repository.InMemoryErrorLogRepository;
import de.jwiegmann.ultraupload.entity.ErrorLog;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Legt jeden behandelten Fehler mit bereinigtem Kontext im Fehlerprotokoll ab.
 */
@Slf4j(topic = "ultra.errors")
public class ErrorLogHandler implements ErrorHandler {

    private static final int MAX_EXCEPTION_MESSAGE_LENGTH = 500;

    private final ErrorMessageFormatter formatter;
    private final InMemoryErrorLogRepository repository;
    private final ErrorManagerProperties.DatabaseLogging settings;
    private final ContextSanitizer sanitizer;
    private final Clock clock;

    public ErrorLogHandler(ErrorMessageFormatter formatter,
                           InMemoryErrorLogRepository repository,
                           ErrorManagerProperties.DatabaseLogging settings,
                           Clock clock) {
        this.formatter = formatter;
        this.repository = repository;
        this.settings = settings;
        this.sanitizer = new ContextSanitizer(settings.getSensitiveKeys(), MAX_EXCEPTION_MESSAGE_LENGTH);
        this.clock = clock;
    }

    @Override
    public boolean shouldHandle(ErrorConfig config) {
        return settings.isEnabled();
    }

    @Override
    public void handle(String errorCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        ErrorLog.ErrorLogBuilder entry = ErrorLog.builder()
                .errorCode(errorCode)
                .type(config.resolvedType().value())
                .blocking(config.resolvedBlocking().value())
                .message(formatter.developerMessage(config, context))
                .userMessage(formatter.userMessage(config, context))
                .httpStatusCode(config.resolvedHttpStatusCode())
                .context(sanitizer.sanitize(context))
                .displayMode(config.getMsgTo())
                .createdAt(LocalDateTime.now(clock));

        if (exception != null) {
            entry.exceptionClass(exception.getClass().getName())
                    .exceptionMessage(sanitizer.truncate(exception.getMessage()))
                    .exceptionTrace(settings.isIncludeTrace() ? trace(exception) : null);
        }

        ErrorLog saved = repository.save(entry.build());
        log.debug("Error {} persisted as log entry {}", errorCode, saved.getId());
    }

    private String trace(Throwable exception) {
        StringWriter writer = new StringWriter();
        exception.printStackTrace(new PrintWriter(writer));
        return ContextSanitizer.truncate(writer.toString(), settings.getMaxTraceLength());
    }
}
