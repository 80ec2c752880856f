package de.jwiegmann.ultraupload.control.repository;

import de.jwiegmann.ultraupload.entity.ErrorLog;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Einfaches In-Memory Repository für Fehlerprotokolle.
 * Map Struktur: Map<id, ErrorLog>, IDs werden fortlaufend vergeben.
 */
@Repository
public class InMemoryErrorLogRepository {

    private final Map<Long, ErrorLog> store = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ErrorLog save(ErrorLog log) {
        if (log.getId() == null) {
            log.setId(sequence.incrementAndGet());
        }
        store.put(log.getId(), log);
        return log;
    }

    public Optional<ErrorLog> find(long id) {
        return Optional.ofNullable(store.get(id));
    }

    /**
     * Neueste zuerst.
     */
    public List<ErrorLog> findAll() {
        List<ErrorLog> all = new ArrayList<>(store.values());
        all.sort(Comparator.comparing(ErrorLog::getCreatedAt).thenComparing(ErrorLog::getId).reversed());
        return all;
    }

    public boolean delete(long id) {
        return store.remove(id) != null;
    }

    /**
     * Löscht alle passenden Einträge und liefert deren Anzahl.
     */
    public int deleteIf(Predicate<ErrorLog> filter) {
        int removed = 0;
        for (Map.Entry<Long, ErrorLog> entry : store.entrySet()) {
            if (filter.test(entry.getValue()) && store.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public long count() {
        return store.size();
    }
}
