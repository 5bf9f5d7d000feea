package de.htwsaar.modelcache.cache.stats;

import de.htwsaar.modelcache.cache.CacheStats;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Führt Treffer, Fehlzugriffe, Evictions sowie Größe und Anzahl der Einträge.
 *
 * <p>Jede Änderung wird sofort an das {@link StatsRepository} durchgeschrieben. Schlägt das
 * Speichern fehl, wird gewarnt und weitergearbeitet; die Zähler im Speicher bleiben maßgeblich.</p>
 *
 * <p>Thread-Safety: alle Methoden {@code synchronized}.</p>
 */
public class CacheStatsTracker {

    private static final Logger log = LoggerFactory.getLogger(CacheStatsTracker.class);

    private final StatsRepository repository;

    private long hits;
    private long misses;
    private long evictions;
    private long totalSize;
    private long entryCount;

    public CacheStatsTracker(StatsRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /**
     * Übernimmt den gespeicherten Stand. Ein unlesbarer Stand führt zu einem Start bei null.
     *
     * @return {@code true} wenn ein Stand geladen wurde
     */
    public synchronized boolean restore() {
        Optional<PersistedStats> loaded;
        try {
            loaded = repository.load();
        } catch (IOException e) {
            log.warn("Could not load persisted cache stats, starting from zero: {}", e.getMessage());
            return false;
        }
        if (loaded.isEmpty()) return false;
        PersistedStats s = loaded.get();
        hits = Math.max(0, s.hitCount());
        misses = Math.max(0, s.missCount());
        evictions = Math.max(0, s.evictionCount());
        totalSize = Math.max(0, s.totalSize());
        entryCount = Math.max(0, s.entryCount());
        return true;
    }

    public synchronized void recordHit() {
        hits++;
        persist();
    }

    public synchronized void recordMiss() {
        misses++;
        persist();
    }

    /**
     * Verbucht einen geschriebenen Eintrag.
     *
     * @param sizeDelta  Größenänderung (bei Überschreiben: neu minus alt)
     * @param countDelta 1 für einen neuen Eintrag, 0 beim Überschreiben
     */
    public synchronized void recordStored(long sizeDelta, long countDelta) {
        totalSize = Math.max(0, totalSize + sizeDelta);
        entryCount = Math.max(0, entryCount + countDelta);
        persist();
    }

    /**
     * Verbucht einen entfernten Eintrag.
     *
     * @param size     Größe des Eintrags
     * @param evicted  {@code true} bei Eviction oder Ablauf, {@code false} bei explizitem Löschen
     */
    public synchronized void recordRemoved(long size, boolean evicted) {
        totalSize = Math.max(0, totalSize - size);
        entryCount = Math.max(0, entryCount - 1);
        if (evicted) evictions++;
        persist();
    }

    /**
     * Setzt Größe und Anzahl auf die tatsächlich gezählten Werte.
     */
    public synchronized void reconcile(long actualTotalSize, long actualEntryCount) {
        if (actualTotalSize == totalSize && actualEntryCount == entryCount) return;
        log.info("Reconciling cache stats: totalSize {} -> {}, entryCount {} -> {}",
                totalSize, actualTotalSize, entryCount, actualEntryCount);
        totalSize = Math.max(0, actualTotalSize);
        entryCount = Math.max(0, actualEntryCount);
        persist();
    }

    /** Alle Zähler auf null, z. B. nach {@code clear}. */
    public synchronized void reset() {
        hits = 0;
        misses = 0;
        evictions = 0;
        totalSize = 0;
        entryCount = 0;
        persist();
    }

    public synchronized long totalSize() {
        return totalSize;
    }

    public synchronized CacheStats snapshot() {
        return CacheStats.of(totalSize, entryCount, hits, misses, evictions);
    }

    private void persist() {
        try {
            repository.save(new PersistedStats(hits, misses, totalSize, entryCount, evictions));
        } catch (IOException | RuntimeException e) {
            log.warn("Persisting cache stats failed: {}", e.getMessage());
        }
    }
}
