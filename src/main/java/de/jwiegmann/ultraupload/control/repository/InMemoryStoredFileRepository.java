package de.jwiegmann.ultraupload.control.repository;

import de.jwiegmann.ultraupload.entity.StoredFile;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Einfaches In-Memory Repository für Dateimetadaten.
 * Map Struktur: Map<id, StoredFile>.
 */
@Repository
public class InMemoryStoredFileRepository {

    private final Map<String, StoredFile> store = new ConcurrentHashMap<>();

    public StoredFile save(StoredFile file) {
        store.put(file.getId(), file);
        return file;
    }

    public Optional<StoredFile> find(String id) {
        return Optional.ofNullable(store.get(id));
    }

    public Optional<StoredFile> updateScanStatus(String id, StoredFile.ScanStatus status, String details) {
        return Optional.ofNullable(store.computeIfPresent(id, (k, f) -> {
            f.setScanStatus(status);
            f.setScanDetails(details);
            f.setUpdatedAt(LocalDateTime.now());
            return f;
        }));
    }
}
