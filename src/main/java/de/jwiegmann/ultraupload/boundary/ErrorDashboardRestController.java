package de.jwiegmann.ultraupload.boundary;

import de.jwiegmann.ultraupload.boundary.dto.ResolveErrorRequest;
import de.jwiegmann.ultraupload.control.error.log.ErrorLogFilter;
import de.jwiegmann.ultraupload.control.error.log.ErrorLogService;
import de.jwiegmann.ultraupload.control.error.log.ErrorStatistics;
import de.jwiegmann.ultraupload.control.error.log.FrequencyPeriod;
import de.jwiegmann.ultraupload.entity.ErrorLog;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fehler-Dashboard: gespeicherte Fehler auflisten, auswerten, lösen und aufräumen.
 */
@RestController
@RequestMapping("/api/errors/dashboard")
public class ErrorDashboardRestController {

    private static final String SYSTEM = "System";
    private static final int SIMILAR_ERRORS = 5;

    private final ErrorLogService errorLogService;

    public ErrorDashboardRestController(ErrorLogService errorLogService) {
        this.errorLogService = errorLogService;
    }

    /**
     * GET /api/errors/dashboard/logs?type=critical&code=SCAN_ERROR&status=unresolved&from=2026-01-01&to=2026-01-31
     */
    @GetMapping("/logs")
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "status", defaultValue = "unresolved") String status,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        List<ErrorLog> errors = errorLogService.search(ErrorLogFilter.builder()
                .type(type)
                .code(code)
                .status(parseStatus(status))
                .from(from)
                .to(to)
                .build());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errors", errors);
        body.put("count", errors.size());
        body.put("status", status.toLowerCase(Locale.ROOT));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/errors/dashboard/logs/{id}
     */
    @GetMapping("/logs/{id}")
    public ResponseEntity<Map<String, Object>> show(@PathVariable long id) {
        ErrorLog error = errorLogService.find(id).orElseThrow(() -> notFound(id));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("similarErrors", errorLogService.similar(error, SIMILAR_ERRORS));
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/errors/dashboard/logs/{id}/resolve
     */
    @PostMapping("/logs/{id}/resolve")
    public ResponseEntity<ErrorLog> resolve(@PathVariable long id,
                                            @RequestBody(required = false) ResolveErrorRequest request) {
        String resolvedBy = request == null ? null : request.getResolvedBy();
        String notes = request == null ? null : request.getNotes();
        return ResponseEntity.ok(errorLogService.resolve(id, resolvedByOrSystem(resolvedBy), notes)
                .orElseThrow(() -> notFound(id)));
    }

    /**
     * POST /api/errors/dashboard/logs/{id}/unresolve
     */
    @PostMapping("/logs/{id}/unresolve")
    public ResponseEntity<ErrorLog> unresolve(@PathVariable long id) {
        return ResponseEntity.ok(errorLogService.unresolve(id).orElseThrow(() -> notFound(id)));
    }

    /**
     * POST /api/errors/dashboard/logs/resolve: mehrere Einträge auf einmal
     */
    @PostMapping("/logs/resolve")
    public ResponseEntity<Map<String, Object>> resolveAll(@RequestBody ResolveErrorRequest request) {
        if (request.getIds() == null || request.getIds().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "no error ids given");
        }
        int updated = errorLogService.resolveAll(request.getIds(),
                resolvedByOrSystem(request.getResolvedBy()), request.getNotes());
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    /**
     * DELETE /api/errors/dashboard/logs/{id}
     */
    @DeleteMapping("/logs/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id) {
        if (!errorLogService.delete(id)) {
            throw notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/errors/dashboard/logs/purge-resolved?olderThan=30
     */
    @PostMapping("/logs/purge-resolved")
    public ResponseEntity<Map<String, Object>> purgeResolved(
            @RequestParam(value = "olderThan", defaultValue = "30") int olderThan) {
        int days = Math.max(1, olderThan);
        int deleted = errorLogService.purgeResolved(days);
        return ResponseEntity.ok(Map.of("deleted", deleted, "olderThanDays", days));
    }

    /**
     * GET /api/errors/dashboard/statistics?period=daily&days=30
     */
    @GetMapping("/statistics")
    public ResponseEntity<ErrorStatistics> statistics(
            @RequestParam(value = "period", defaultValue = "daily") String period,
            @RequestParam(value = "days", defaultValue = "30") int days) {
        return ResponseEntity.ok(errorLogService.statistics(FrequencyPeriod.parse(period), days));
    }

    private static ErrorLogFilter.Status parseStatus(String status) {
        for (ErrorLogFilter.Status candidate : ErrorLogFilter.Status.values()) {
            if (candidate.name().equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unknown status " + status);
    }

    private static String resolvedByOrSystem(String resolvedBy) {
        return resolvedBy == null || resolvedBy.isBlank() ? SYSTEM : resolvedBy;
    }

    private static ResponseStatusException notFound(long id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "error log " + id + " not found");
    }
}
