package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.control.simulation.EnvironmentPolicy;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;

/**
 * Sperrt Simulationsrouten außerhalb von local, development, testing und staging mit 403.
 */
@Slf4j(topic = "ultra.errors")
@Component
@RequiredArgsConstructor
public class EnvironmentGuardInterceptor implements HandlerInterceptor {

    private final EnvironmentPolicy environmentPolicy;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (environmentPolicy.isSimulationAllowed()) {
            return true;
        }
        log.warn("Blocked {} {} in environment {}", request.getMethod(), request.getRequestURI(),
                environmentPolicy.currentEnvironment());
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(
                "{\"success\":false,\"message\":\"Error simulation is not available in this environment\"}");
        return false;
    }
}
