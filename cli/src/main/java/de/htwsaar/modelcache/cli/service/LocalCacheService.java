package de.htwsaar.modelcache.cli.service;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.expiry.ExpirationSweeper;
import de.htwsaar.modelcache.cache.stats.JsonFileStatsRepository;
import de.htwsaar.modelcache.cache.storage.StorageBackendFactory;
import de.htwsaar.modelcache.cache.storage.StorageSettings;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Öffnet den Model-Cache eines lokalen Verzeichnisses für genau einen CLI-Aufruf.
 *
 * <p>Der periodische Sweep wird nicht gestartet; abgelaufene Einträge verschwinden beim Zugriff
 * oder über {@code modelcache sweep}. Der Aufrufer schließt den Cache.</p>
 */
public final class LocalCacheService {

    private static final Logger log = LoggerFactory.getLogger(LocalCacheService.class);

    private final Clock clock;

    public LocalCacheService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param options aufgelöste Root-Optionen
     * @return geöffneter Cache
     * @throws IllegalArgumentException bei ungültiger Konfiguration
     */
    public ModelCache open(CacheOptions options) {
        Objects.requireNonNull(options, "options");
        log.debug("Opening local model cache in {} with backend {}", options.dir(), options.storageType());
        return ModelCache.open(
                options.toConfig(),
                new StorageBackendFactory(StorageSettings.under(options.dir())),
                new JsonFileStatsRepository(options.dir().resolve(JsonFileStatsRepository.DEFAULT_FILE_NAME)),
                clock,
                ExpirationSweeper.DEFAULT_INTERVAL);
    }
}
