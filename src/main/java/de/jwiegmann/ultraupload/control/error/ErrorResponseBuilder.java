package de.jwiegmann.ultraupload.control.error;

import org.springframework.stereotype.Component;

/**
 * Wählt die Antwortform: JSON für API/XHR, sonst blockierend oder weiterlaufen.
 * Wirft selbst nie.
 */
@Component
public class ErrorResponseBuilder {

    public ErrorResponse build(ErrorInfo info, RequestShape request) {
        if (request != null && request.wantsJson()) {
            return ErrorResponse.json(info);
        }
        if (info.getBlocking() == BlockingLevel.BLOCKING) {
            return ErrorResponse.blocking(info);
        }
        return ErrorResponse.proceed(info);
    }
}
