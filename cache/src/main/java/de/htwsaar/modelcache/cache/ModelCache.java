package de.htwsaar.modelcache.cache;

import de.htwsaar.modelcache.cache.error.BackendUnavailableException;
import de.htwsaar.modelcache.cache.error.CapacityExceededException;
import de.htwsaar.modelcache.cache.error.StorageBackendException;
import de.htwsaar.modelcache.cache.eviction.EvictionPolicy;
import de.htwsaar.modelcache.cache.eviction.LruEvictionPolicy;
import de.htwsaar.modelcache.cache.expiry.ExpirationSweeper;
import de.htwsaar.modelcache.cache.expiry.ExpiryRule;
import de.htwsaar.modelcache.cache.expiry.SweepResult;
import de.htwsaar.modelcache.cache.integrity.IntegrityChecker;
import de.htwsaar.modelcache.cache.integrity.IntegrityStatus;
import de.htwsaar.modelcache.cache.stats.CacheStatsTracker;
import de.htwsaar.modelcache.cache.stats.StatsRepository;
import de.htwsaar.modelcache.cache.storage.BackendSelection;
import de.htwsaar.modelcache.cache.storage.StorageBackend;
import de.htwsaar.modelcache.cache.storage.StorageBackendFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fassade des Model-Caches: Speichern, Lesen und Entfernen von Modell-Artefakten unter einem
 * Größen- und Altersbudget.
 *
 * <p>Ablauf beim Speichern: Größe und Prüfsumme berechnen, Platz schaffen (LRU-Eviction),
 * Eintrag schreiben, Statistik buchen. Beim Lesen gelten abgelaufene Einträge als nicht vorhanden
 * und werden sofort entfernt.</p>
 *
 * <p>Lebenszyklus: {@link #open} wählt das Backend (mit Fallback) und stellt die Statistik wieder
 * her, {@link #start()} startet den Sweeper, {@link #close()} stoppt ihn und schließt das Backend.</p>
 *
 * <p>Thread-Safety: alle verändernden Schritte (Schreiben, Löschen, Eviction, Ablauf, Zugriffszeit,
 * Backend-Wechsel) laufen unter einem gemeinsamen Lock. Damit ist die Platzbuchhaltung exakt.
 * Reine Lesezugriffe auf das Backend laufen ohne Lock.</p>
 */
public class ModelCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    private final CacheConfigService configService;
    private final StorageBackendFactory backendFactory;
    private final CacheStatsTracker stats;
    private final IntegrityChecker integrity;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;
    private final ExpirationSweeper sweeper;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile StorageBackend backend;
    private volatile boolean fallbackActive;

    ModelCache(
            CacheConfigService configService,
            StorageBackendFactory backendFactory,
            BackendSelection selection,
            CacheStatsTracker stats,
            IntegrityChecker integrity,
            EvictionPolicy evictionPolicy,
            Clock clock,
            Duration sweepInterval) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory must not be null");
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.integrity = Objects.requireNonNull(integrity, "integrity must not be null");
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(selection, "selection must not be null");
        this.backend = selection.backend();
        this.fallbackActive = selection.fallback();
        this.sweeper = new ExpirationSweeper(new SweepTarget(), clock, sweepInterval);
    }

    /**
     * Baut einen einsatzbereiten, noch nicht gestarteten Cache.
     *
     * <p>Ist das konfigurierte Backend nicht verfügbar, wird auf {@link StorageType#MEMORY}
     * ausgewichen. Treffer-, Fehlzugriffs- und Eviction-Zähler werden aus dem Repository
     * fortgeführt; Größe und Anzahl werden am Backend nachgezählt.</p>
     *
     * @param config          Startkonfiguration
     * @param backendFactory  Fabrik für Storage-Backends
     * @param statsRepository Ablage der Statistik
     * @param clock           Zeitquelle
     * @param sweepInterval   Abstand zwischen zwei Sweeps
     * @return geöffneter Cache
     */
    public static ModelCache open(
            CacheConfig config,
            StorageBackendFactory backendFactory,
            StatsRepository statsRepository,
            Clock clock,
            Duration sweepInterval) {
        Objects.requireNonNull(config, "config must not be null");
        BackendSelection selection = backendFactory.openWithFallback(config.storageType());

        CacheConfigService configService = new CacheConfigService(config);
        if (selection.fallback()) {
            configService.markActiveStorage(selection.active());
        }

        CacheStatsTracker stats = new CacheStatsTracker(statsRepository);
        stats.restore();

        ModelCache cache = new ModelCache(
                configService,
                backendFactory,
                selection,
                stats,
                new IntegrityChecker(),
                new LruEvictionPolicy(),
                clock,
                sweepInterval);
        try {
            cache.reconcileTotals();
        } catch (RuntimeException e) {
            selection.backend().close();
            throw e;
        }
        log.info("Model cache ready: backend={} fallback={} maxSize={} maxAge={}",
                selection.active(), selection.fallback(), config.maxSizeBytes(), config.maxAge());
        return cache;
    }

    /** Startet den periodischen Ablauf-Sweep. */
    public void start() {
        sweeper.start();
    }

    /**
     * Speichert ein Artefakt und ersetzt einen vorhandenen Eintrag gleicher ID vollständig.
     *
     * @param id      Modell-ID
     * @param payload Artefakt-Bytes
     * @param version Versionslabel des Aufrufers (opak, darf {@code null} sein)
     * @throws CapacityExceededException wenn das Artefakt allein größer als das Budget ist
     * @throws StorageBackendException   wenn Schreiben scheitert oder nicht genug Platz frei wird
     */
    public void store(String id, byte[] payload, String version) {
        requireId(id);
        Objects.requireNonNull(payload, "payload must not be null");

        CacheConfig config = configService.current();
        long size = payload.length;
        if (size > config.maxSizeBytes()) {
            throw new CapacityExceededException(id, size, config.maxSizeBytes());
        }

        byte[] copy = payload.clone();
        String checksum = integrity.checksum(copy);

        lock.lock();
        try {
            Optional<EntryMetadata> existing = backend.getMetadata(id);
            long existingSize = existing.map(EntryMetadata::size).orElse(0L);

            ensureSpace(id, size - existingSize, config.maxSizeBytes());

            long now = clock.millis();
            EntryMetadata metadata = new EntryMetadata(id, size, now, now, version, checksum);
            backend.put(new CacheEntry(metadata, copy));
            stats.recordStored(size - existingSize, existing.isPresent() ? 0 : 1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Liest ein Artefakt.
     *
     * <p>Der Aufrufer erhält eine eigene Kopie; Änderungen daran erreichen den Cache nicht.</p>
     *
     * @param id Modell-ID
     * @return Payload oder leer bei Fehlzugriff (unbekannt, abgelaufen oder korrupt)
     */
    public Optional<byte[]> retrieve(String id) {
        requireId(id);
        return lookup(id).map(entry -> entry.payload().clone());
    }

    /**
     * Wie {@link #retrieve(String)}, ohne den Payload zu liefern. Zählt ebenfalls als Treffer oder
     * Fehlzugriff und entfernt abgelaufene Einträge.
     *
     * @param id Modell-ID
     * @return {@code true} bei Treffer
     */
    public boolean has(String id) {
        requireId(id);
        CacheConfig config = configService.current();
        if (config.verifyOnRead()) {
            return lookup(id).isPresent();
        }
        Optional<EntryMetadata> found = backend.getMetadata(id);
        if (found.isEmpty()) {
            stats.recordMiss();
            return false;
        }
        long now = clock.millis();
        if (expiredOnAccess(found.get(), config, now)) {
            stats.recordMiss();
            return false;
        }
        touch(id, now);
        stats.recordHit();
        return true;
    }

    /**
     * Entfernt einen Eintrag. Mehrfaches Entfernen ist unkritisch.
     *
     * @param id Modell-ID
     * @return {@code true} wenn tatsächlich etwas entfernt wurde
     */
    public boolean remove(String id) {
        requireId(id);
        lock.lock();
        try {
            Optional<EntryMetadata> existing = backend.getMetadata(id);
            if (existing.isEmpty()) return false;
            if (!backend.delete(id)) return false;
            stats.recordRemoved(existing.get().size(), false);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entfernt alle Einträge des aktiven Backends und setzt die Statistik zurück.
     *
     * @return Anzahl entfernter Einträge
     */
    public int clear() {
        lock.lock();
        try {
            int removed = 0;
            for (EntryMetadata m : backend.listAll()) {
                try {
                    if (backend.delete(m.id())) removed++;
                } catch (StorageBackendException e) {
                    log.warn("Clear could not delete '{}': {}", m.id(), e.getMessage());
                }
            }
            stats.reset();
            reconcileTotals();
            log.info("Cache cleared: {} entries removed", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        return stats.snapshot();
    }

    public CacheConfig getConfig() {
        return configService.current();
    }

    /**
     * Übernimmt ein partielles Konfigurations-Update.
     *
     * <p>Ein neuer {@code storageType} öffnet das neue Backend; Einträge des alten bleiben dort
     * liegen und werden nicht mehr ausgeliefert. Nach einem Fallback bleibt der Cache auf
     * {@link StorageType#MEMORY}. Ein kleineres {@code maxSize} wirkt erst beim nächsten
     * {@code store}.</p>
     *
     * @param update nur gesetzte Felder werden übernommen
     * @return die neue Konfiguration
     * @throws IllegalArgumentException    bei ungültigen Werten; nichts wird geändert
     * @throws BackendUnavailableException wenn das neue Backend nicht geöffnet werden kann
     */
    public CacheConfig updateConfig(CacheConfigUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        lock.lock();
        try {
            CacheConfig current = configService.current();
            CacheConfigUpdate effective = update;
            StorageType requested = update.storageType();

            if (requested != null && requested != current.storageType()) {
                if (fallbackActive) {
                    log.warn("Ignoring storage type change to {}: cache runs on MEMORY after fallback", requested);
                    effective = new CacheConfigUpdate(
                            update.maxSizeBytes(), update.maxAge(), null,
                            update.compressionEnabled(), update.verifyOnRead());
                } else {
                    // validiert den Rest, bevor das Backend gewechselt wird
                    current.merge(update);
                    switchBackend(requested);
                }
            }
            CacheConfig next = configService.patch(effective);
            log.info("Cache config updated: {}", next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rechnet die Prüfsumme eines Eintrags nach. Korrupte Einträge werden entfernt.
     *
     * @param id Modell-ID
     * @return Ergebnis der Prüfung
     */
    public IntegrityStatus verify(String id) {
        requireId(id);
        Optional<CacheEntry> found = backend.get(id);
        if (found.isEmpty()) return IntegrityStatus.ABSENT;
        CacheEntry entry = found.get();
        if (ExpiryRule.isExpired(entry.metadata().createdAtMs(), clock.millis(), configService.current().maxAge())) {
            return IntegrityStatus.ABSENT;
        }
        if (integrity.isIntact(entry)) return IntegrityStatus.INTACT;
        discardCorrupt(entry);
        return IntegrityStatus.CORRUPT;
    }

    /**
     * Momentaufnahme der lebenden Einträge, nächster Eviction-Kandidat zuerst.
     *
     * @return nicht abgelaufene Einträge
     */
    public List<EntryMetadata> list() {
        long now = clock.millis();
        Duration maxAge = configService.current().maxAge();
        return backend.listLeastRecentlyAccessed().stream()
                .filter(m -> !ExpiryRule.isExpired(m.createdAtMs(), now, maxAge))
                .toList();
    }

    /**
     * Führt sofort einen Sweep im aufrufenden Thread aus.
     *
     * @return Zähler des Durchlaufs
     */
    public SweepResult sweepExpired() {
        return sweeper.runOnce();
    }

    public StorageType activeStorageType() {
        return backend.type();
    }

    public boolean isFallbackActive() {
        return fallbackActive;
    }

    public boolean isSweeperRunning() {
        return sweeper.isRunning();
    }

    @Override
    public void close() {
        sweeper.close();
        lock.lock();
        try {
            backend.close();
        } finally {
            lock.unlock();
        }
    }

    private Optional<CacheEntry> lookup(String id) {
        CacheConfig config = configService.current();
        Optional<CacheEntry> found = backend.get(id);
        if (found.isEmpty()) {
            stats.recordMiss();
            return Optional.empty();
        }
        CacheEntry entry = found.get();
        long now = clock.millis();
        if (expiredOnAccess(entry.metadata(), config, now)) {
            stats.recordMiss();
            return Optional.empty();
        }
        if (config.verifyOnRead() && !integrity.isIntact(entry)) {
            discardCorrupt(entry);
            stats.recordMiss();
            return Optional.empty();
        }
        touch(id, now);
        stats.recordHit();
        return Optional.of(entry.withLastAccessed(now));
    }

    private boolean expiredOnAccess(EntryMetadata metadata, CacheConfig config, long now) {
        if (!ExpiryRule.isExpired(metadata.createdAtMs(), now, config.maxAge())) return false;
        expire(metadata.id(), now);
        return true;
    }

    private void touch(String id, long now) {
        lock.lock();
        try {
            backend.touch(id, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entfernt einen Eintrag, falls er zum Zeitpunkt {@code now} noch abgelaufen ist. Ein
     * zwischenzeitlich neu gespeicherter oder bereits entfernter Eintrag bleibt unberührt.
     */
    private boolean expire(String id, long now) {
        lock.lock();
        try {
            Optional<EntryMetadata> current = backend.getMetadata(id);
            if (current.isEmpty()) return false;
            if (!ExpiryRule.isExpired(current.get().createdAtMs(), now, configService.current().maxAge())) {
                return false;
            }
            if (!backend.delete(id)) return false;
            stats.recordRemoved(current.get().size(), true);
            log.debug("Expired '{}' (age {} ms)", id, current.get().ageMs(now));
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void discardCorrupt(CacheEntry corrupt) {
        String id = corrupt.id();
        lock.lock();
        try {
            Optional<EntryMetadata> current = backend.getMetadata(id);
            // nur löschen, wenn inzwischen nicht neu gespeichert wurde
            if (current.isEmpty() || !current.get().checksum().equals(corrupt.metadata().checksum())
                    || current.get().createdAtMs() != corrupt.metadata().createdAtMs()) {
                return;
            }
            if (backend.delete(id)) {
                stats.recordRemoved(current.get().size(), false);
            }
            log.warn("Removed corrupt entry '{}': payload does not match sha256 {}", id, corrupt.metadata().checksum());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schafft Platz für {@code additionalBytes}. Muss unter dem Lock laufen.
     *
     * @param keepId          ID, die gerade gespeichert wird und nie Opfer sein darf
     * @param additionalBytes zusätzlicher Bedarf (negativ beim Verkleinern)
     * @param maxSize         Budget
     */
    private void ensureSpace(String keepId, long additionalBytes, long maxSize) {
        long bytesToFree = stats.totalSize() + additionalBytes - maxSize;
        if (bytesToFree <= 0) return;

        Set<String> skipped = new HashSet<>();
        while (bytesToFree > 0) {
            Map<String, EntryMetadata> candidates = new HashMap<>();
            for (EntryMetadata m : backend.listLeastRecentlyAccessed()) {
                if (!m.id().equals(keepId) && !skipped.contains(m.id())) {
                    candidates.put(m.id(), m);
                }
            }
            if (candidates.isEmpty()) break;

            List<String> victims = evictionPolicy.selectVictims(List.copyOf(candidates.values()), bytesToFree);
            if (victims.isEmpty()) break;

            for (String victim : victims) {
                if (bytesToFree <= 0) break;
                EntryMetadata m = candidates.get(victim);
                try {
                    if (backend.delete(victim)) {
                        stats.recordRemoved(m.size(), true);
                        bytesToFree -= m.size();
                        log.debug("Evicted '{}' ({} bytes, last access {})", victim, m.size(), m.lastAccessedAtMs());
                    } else {
                        skipped.add(victim);
                    }
                } catch (StorageBackendException e) {
                    skipped.add(victim);
                    log.warn("Eviction of '{}' failed, trying next candidate: {}", victim, e.getMessage());
                }
            }
        }

        if (bytesToFree > 0) {
            throw new StorageBackendException("Could not free " + bytesToFree + " more bytes for '" + keepId + "'");
        }
    }

    private void switchBackend(StorageType type) {
        StorageBackend next = backendFactory.open(type);
        StorageBackend previous = backend;
        backend = next;
        reconcileTotals();
        previous.close();
        log.info("Switched storage backend {} -> {}; entries of the previous backend are no longer served",
                previous.type(), next.type());
    }

    private void reconcileTotals() {
        lock.lock();
        try {
            long totalSize = 0;
            long count = 0;
            for (EntryMetadata m : backend.listAll()) {
                totalSize += m.size();
                count++;
            }
            stats.reconcile(totalSize, count);
        } finally {
            lock.unlock();
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    private final class SweepTarget implements ExpirationSweeper.Target {

        @Override
        public List<EntryMetadata> listEntries() {
            return backend.listAll();
        }

        @Override
        public Duration maxAge() {
            return configService.current().maxAge();
        }

        @Override
        public boolean expire(String id, long nowMs) {
            return ModelCache.this.expire(id, nowMs);
        }

        @Override
        public void reconcile() {
            reconcileTotals();
        }
    }
}
