package de.jwiegmann.ultraupload.control.error.log;

import de.jwiegmann.ultraupload.control.error.ErrorType;
import de.jwiegmann.ultraupload.control.repository.InMemoryErrorLogRepository;
import de.jwiegmann.ultraupload.entity.ErrorLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Auswertung und Pflege des Fehlerprotokolls für das Dashboard.
 */
@Slf4j(topic = "ultra.errors")
@Service
public class ErrorLogService {

    static final int TOP_CODES = 10;
    static final int MIN_PERIODS = 7;
    static final int MAX_PERIODS = 90;

    private final InMemoryErrorLogRepository repository;
    private final Clock clock;

    public ErrorLogService(InMemoryErrorLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Neueste Einträge zuerst.
     */
    public List<ErrorLog> search(ErrorLogFilter filter) {
        return repository.findAll().stream()
                .filter(entry -> filter.getType() == null || filter.getType().equalsIgnoreCase(entry.getType()))
                .filter(entry -> filter.getCode() == null || filter.getCode().equals(entry.getErrorCode()))
                .filter(entry -> filter.getStatus() == ErrorLogFilter.Status.ALL
                        || (filter.getStatus() == ErrorLogFilter.Status.RESOLVED) == entry.isResolved())
                .filter(entry -> filter.getFrom() == null
                        || !entry.getCreatedAt().toLocalDate().isBefore(filter.getFrom()))
                .filter(entry -> filter.getTo() == null
                        || !entry.getCreatedAt().toLocalDate().isAfter(filter.getTo()))
                .collect(Collectors.toList());
    }

    public Optional<ErrorLog> find(long id) {
        return repository.find(id);
    }

    /**
     * Andere Einträge mit demselben Code, neueste zuerst.
     */
    public List<ErrorLog> similar(ErrorLog errorLog, int limit) {
        return repository.findAll().stream()
                .filter(other -> other.getErrorCode().equals(errorLog.getErrorCode())
                        && !other.getId().equals(errorLog.getId()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    public Optional<ErrorLog> resolve(long id, String resolvedBy, String notes) {
        return repository.find(id).map(errorLog -> {
            errorLog.markAsResolved(resolvedBy, notes, LocalDateTime.now(clock));
            return repository.save(errorLog);
        });
    }

    public Optional<ErrorLog> unresolve(long id) {
        return repository.find(id).map(errorLog -> {
            errorLog.markAsUnresolved();
            return repository.save(errorLog);
        });
    }

    /**
     * Markiert alle noch offenen Einträge aus {@code ids} als gelöst.
     *
     * @return Anzahl der tatsächlich geänderten Einträge
     */
    public int resolveAll(Collection<Long> ids, String resolvedBy, String notes) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = 0;
        for (Long id : ids) {
            Optional<ErrorLog> errorLog = id == null ? Optional.empty() : repository.find(id);
            if (errorLog.isPresent() && !errorLog.get().isResolved()) {
                errorLog.get().markAsResolved(resolvedBy, notes, now);
                repository.save(errorLog.get());
                updated++;
            }
        }
        return updated;
    }

    public boolean delete(long id) {
        return repository.delete(id);
    }

    /**
     * Löscht gelöste Einträge, die vor Beginn des Tages {@code heute - olderThanDays} entstanden sind.
     */
    public int purgeResolved(int olderThanDays) {
        int days = Math.max(1, olderThanDays);
        LocalDateTime threshold = LocalDate.now(clock).minusDays(days).atStartOfDay();
        int deleted = repository.deleteIf(entry -> entry.isResolved() && entry.getCreatedAt().isBefore(threshold));
        log.info("Purged {} resolved error logs older than {} days", deleted, days);
        return deleted;
    }

    /**
     * @param periods Anzahl der Rasterpunkte, begrenzt auf 7 bis 90
     */
    public ErrorStatistics statistics(FrequencyPeriod period, int periods) {
        int count = Math.min(Math.max(periods, MIN_PERIODS), MAX_PERIODS);
        LocalDate today = LocalDate.now(clock);
        List<ErrorLog> all = repository.findAll();

        List<ErrorStatistics.CodeCount> topCodes = countBy(all, ErrorLog::getErrorCode).entrySet().stream()
                .limit(TOP_CODES)
                .map(entry -> new ErrorStatistics.CodeCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());

        Map<String, List<ErrorStatistics.PeriodCount>> frequency = new LinkedHashMap<>();
        for (ErrorStatistics.CodeCount code : topCodes) {
            frequency.put(code.getErrorCode(), frequency(all, code.getErrorCode(), period, count, today));
        }

        return ErrorStatistics.builder()
                .total(all.size())
                .unresolved(all.stream().filter(errorLog -> !errorLog.isResolved()).count())
                .critical(all.stream().filter(entry -> ErrorType.CRITICAL.value().equals(entry.getType())).count())
                .today(all.stream().filter(errorLog -> errorLog.getCreatedAt().toLocalDate().equals(today)).count())
                .period(period.value())
                .periods(count)
                .topErrorCodes(topCodes)
                .byType(countBy(all, ErrorLog::getType))
                .frequency(frequency)
                .build();
    }

    List<ErrorStatistics.PeriodCount> frequency(List<ErrorLog> logs, String errorCode, FrequencyPeriod period,
                                                int periods, LocalDate today) {
        LocalDate start = period.start(today, periods);
        Map<String, Long> counts = logs.stream()
                .filter(errorLog -> errorLog.getErrorCode().equals(errorCode))
                .map(errorLog -> errorLog.getCreatedAt().toLocalDate())
                .filter(date -> !date.isBefore(start) && !date.isAfter(today))
                .collect(Collectors.groupingBy(period::key, Collectors.counting()));

        List<ErrorStatistics.PeriodCount> result = new ArrayList<>();
        LocalDate current = start;
        for (int i = 0; i < periods && !current.isAfter(today); i++) {
            String key = period.key(current);
            result.add(new ErrorStatistics.PeriodCount(key, counts.getOrDefault(key, 0L)));
            current = period.next(current);
        }
        return result;
    }

    /**
     * Zählt nach Schlüssel, absteigend nach Anzahl, bei Gleichstand alphabetisch.
     */
    private static Map<String, Long> countBy(List<ErrorLog> logs, Function<ErrorLog, String> key) {
        Map<String, Long> counts = logs.stream().collect(Collectors.groupingBy(key, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }
}
