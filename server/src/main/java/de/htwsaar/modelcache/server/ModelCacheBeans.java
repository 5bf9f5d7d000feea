package de.htwsaar.modelcache.server;

import de.htwsaar.modelcache.cache.CacheConfig;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.stats.JsonFileStatsRepository;
import de.htwsaar.modelcache.cache.stats.StatsRepository;
import de.htwsaar.modelcache.cache.storage.StorageBackendFactory;
import de.htwsaar.modelcache.cache.storage.StorageSettings;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung des Model-Caches.
 *
 * <p>Schichtung: Controller → {@link ModelCache} → Backends/Stats. Der Cache wird hier genau
 * einmal gebaut und gestartet; Spring schließt ihn beim Herunterfahren.</p>
 */
@Configuration
public class ModelCacheBeans {

    /**
     * Systemuhr für den gesamten Cache-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Startkonfiguration aus den Properties.
     *
     * @param maxSizeBytes       Größenbudget in Bytes (Standard: 500 MiB)
     * @param maxAge             Höchstalter, z. B. {@code 7d} oder {@code PT12H}
     * @param storageType        Backend, z. B. {@code durable-kv}
     * @param compressionEnabled Kompressions-Hinweis
     * @param verifyOnRead       Prüfsumme bei jedem Lesen nachrechnen
     * @return validierte {@link CacheConfig}
     */
    @Bean
    public CacheConfig cacheConfig(
            @Value("${modelcache.max-size-bytes:524288000}") long maxSizeBytes,
            @Value("${modelcache.max-age:7d}") String maxAge,
            @Value("${modelcache.storage-type:durable-kv}") String storageType,
            @Value("${modelcache.compression-enabled:true}") boolean compressionEnabled,
            @Value("${modelcache.verify-on-read:false}") boolean verifyOnRead) {

        return new CacheConfig(
                maxSizeBytes,
                DurationStyle.detectAndParse(maxAge),
                StorageType.parse(storageType),
                compressionEnabled,
                verifyOnRead);
    }

    @Bean
    public StorageBackendFactory storageBackendFactory(@Value("${modelcache.data-dir:./data}") String dataDir) {
        return new StorageBackendFactory(StorageSettings.under(Path.of(dataDir)));
    }

    @Bean
    public StatsRepository statsRepository(@Value("${modelcache.data-dir:./data}") String dataDir) {
        return new JsonFileStatsRepository(Path.of(dataDir).resolve(JsonFileStatsRepository.DEFAULT_FILE_NAME));
    }

    /**
     * Geöffneter und gestarteter Cache.
     *
     * @param config          Startkonfiguration
     * @param backendFactory  Backend-Fabrik
     * @param statsRepository Ablage der Statistik
     * @param clock           Zeitquelle
     * @param sweepInterval   Sweep-Abstand (Standard: 1h)
     * @return {@link ModelCache}, wird beim Shutdown geschlossen
     */
    @Bean(destroyMethod = "close")
    public ModelCache modelCache(
            CacheConfig config,
            StorageBackendFactory backendFactory,
            StatsRepository statsRepository,
            Clock clock,
            @Value("${modelcache.sweep-interval:1h}") String sweepInterval) {

        ModelCache cache = ModelCache.open(
                config, backendFactory, statsRepository, clock, DurationStyle.detectAndParse(sweepInterval));
        cache.start();
        return cache;
    }
}
