package de.htwsaar.modelcache.cache.stats;

import java.io.IOException;
import java.util.Optional;

/**
 * Ablage der Statistik über Neustarts hinweg.
 */
public interface StatsRepository {

    /**
     * @return zuletzt gespeicherter Stand oder leer, wenn noch nie gespeichert wurde
     * @throws IOException wenn ein vorhandener Stand nicht gelesen werden kann
     */
    Optional<PersistedStats> load() throws IOException;

    void save(PersistedStats stats) throws IOException;
}
