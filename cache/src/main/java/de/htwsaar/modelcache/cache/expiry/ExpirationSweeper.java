package de.htwsaar.modelcache.cache.expiry;

import de.htwsaar.modelcache.cache.EntryMetadata;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entfernt periodisch abgelaufene Einträge im Hintergrund.
 *
 * <p>Ein einzelner Daemon-Thread läuft mit festem Abstand zwischen zwei Durchläufen. Fehler bei
 * einzelnen Einträgen werden geloggt und übersprungen; ein Durchlauf bricht den Zeitplan nie ab.
 * Nach einem fehlerfreien Durchlauf werden die Summen der Statistik mit dem Bestand abgeglichen.</p>
 */
public class ExpirationSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
    static final String THREAD_NAME = "model-cache-sweeper";

    /**
     * Sicht des Sweepers auf den Cache.
     */
    public interface Target {

        /** Momentaufnahme aller Einträge. */
        List<EntryMetadata> listEntries();

        /** Aktuell gültiges Höchstalter. */
        Duration maxAge();

        /**
         * Entfernt den Eintrag, falls er zum Zeitpunkt {@code nowMs} (noch) abgelaufen ist.
         *
         * @return {@code true} wenn entfernt wurde
         */
        boolean expire(String id, long nowMs);

        /** Gleicht Größen- und Anzahlzähler mit dem Bestand ab. */
        void reconcile();
    }

    private final Target target;
    private final Clock clock;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public ExpirationSweeper(Target target, Clock clock, Duration interval) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Startet den periodischen Sweep. Mehrfacher Aufruf ist wirkungslos.
     */
    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        long intervalMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runScheduled, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Expiration sweeper started (interval {})", interval);
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * Ein vollständiger Durchlauf im aufrufenden Thread.
     *
     * @return Zähler des Durchlaufs
     * @throws de.htwsaar.modelcache.cache.error.StorageBackendException wenn schon das Auflisten scheitert
     */
    public SweepResult runOnce() {
        long nowMs = clock.millis();
        Duration maxAge = target.maxAge();
        List<EntryMetadata> entries = target.listEntries();

        int expired = 0;
        int failed = 0;
        for (EntryMetadata m : entries) {
            if (!ExpiryRule.isExpired(m.createdAtMs(), nowMs, maxAge)) continue;
            try {
                if (target.expire(m.id(), nowMs)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Sweep could not expire '{}': {}", m.id(), e.getMessage());
            }
        }

        if (failed == 0) {
            target.reconcile();
        }

        SweepResult result = new SweepResult(entries.size(), expired, failed);
        if (expired > 0 || failed > 0) {
            log.info("Sweep finished: scanned={} expired={} failed={}", result.scanned(), expired, failed);
        } else {
            log.debug("Sweep finished: scanned={} nothing expired", result.scanned());
        }
        return result;
    }

    private void runScheduled() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // der Executor würde sonst alle Folgeläufe stillschweigend absagen
            log.warn("Sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Expiration sweeper did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}
