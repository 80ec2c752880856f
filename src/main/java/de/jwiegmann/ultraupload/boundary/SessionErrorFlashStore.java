package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.control.error.ErrorFlashStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.FlashMap;
import org.springframework.web.servlet.support.RequestContextUtils;

/**
 * Legt Fehlerdaten in die Flash-Attribute des laufenden Requests.
 * Außerhalb eines Requests (z.B. im Scan-Thread) wird nichts abgelegt.
 */
@Slf4j(topic = "ultra.errors")
@Component
public class SessionErrorFlashStore implements ErrorFlashStore {

    @Override
    public void flash(String key, Object value) {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes)) {
            log.debug("No active request, flash attribute {} dropped", key);
            return;
        }
        HttpServletRequest request = ((ServletRequestAttributes) attributes).getRequest();
        FlashMap flashMap = RequestContextUtils.getOutputFlashMap(request);
        if (flashMap == null) {
            log.debug("Request {} has no output flash map, attribute {} dropped", request.getRequestURI(), key);
            return;
        }
        flashMap.put(key, value);
    }
}
