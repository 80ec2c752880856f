package de.jwiegmann.ultraupload.control.error;

import de.jwiegmann.ultraupload.config.ErrorManagerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ErrorInfoFactory {

    private final ErrorMessageFormatter formatter;
    private final ErrorManagerProperties properties;
    private final Clock clock;

    public ErrorInfo create(String resolvedCode, ErrorConfig config, Map<String, Object> context, Throwable exception) {
        String displayMode = config.getMsgTo() != null
                ? config.getMsgTo()
                : properties.getUi().getDefaultDisplayMode();

        return ErrorInfo.builder()
                .errorCode(resolvedCode)
                .type(config.resolvedType())
                .blocking(config.resolvedBlocking())
                .message(formatter.developerMessage(config, context))
                .userMessage(formatter.userMessage(config, context))
                .httpStatusCode(config.resolvedHttpStatusCode())
                .context(Collections.unmodifiableMap(new LinkedHashMap<>(context)))
                .displayMode(displayMode)
                .timestamp(OffsetDateTime.now(clock))
                .exception(ExceptionSummary.of(exception))
                .build();
    }
}
