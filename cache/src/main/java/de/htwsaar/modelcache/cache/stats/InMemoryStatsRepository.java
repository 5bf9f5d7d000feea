package de.htwsaar.modelcache.cache.stats;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Flüchtige Ablage für Tests und Caches ohne Datenverzeichnis.
 */
public final class InMemoryStatsRepository implements StatsRepository {

    private final AtomicReference<PersistedStats> current = new AtomicReference<>();

    @Override
    public Optional<PersistedStats> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void save(PersistedStats stats) {
        current.set(stats);
    }
}
