package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.CacheEntry;
import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.StorageType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prozesslokales Backend auf Basis einer {@link ConcurrentHashMap}.
 * Daten überleben keinen Neustart; dient als Fallback für alle anderen Backends.
 */
public final class InMemoryStorageBackend implements StorageBackend {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public StorageType type() {
        return StorageType.MEMORY;
    }

    @Override
    public void put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.put(entry.id(), entry);
    }

    @Override
    public Optional<CacheEntry> get(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public boolean delete(String id) {
        if (id == null) return false;
        return entries.remove(id) != null;
    }

    @Override
    public List<EntryMetadata> listAll() {
        return entries.values().stream().map(CacheEntry::metadata).toList();
    }

    @Override
    public boolean touch(String id, long accessedAtMs) {
        if (id == null) return false;
        return entries.computeIfPresent(id, (k, e) -> e.withLastAccessed(accessedAtMs)) != null;
    }

    @Override
    public void close() {
        // nichts freizugeben; Einträge verfallen mit dem Prozess
    }
}
