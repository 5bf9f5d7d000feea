package de.htwsaar.modelcache.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Unveränderliche Konfiguration des Model-Caches. Live-Änderungen laufen über
 * {@link CacheConfigService#patch(CacheConfigUpdate)}.
 *
 * @param maxSizeBytes       Größenbudget in Bytes
 * @param maxAge             maximales Alter eines Eintrags
 * @param storageType        aktives Backend
 * @param compressionEnabled Hinweis an Aufrufer, ob Payloads komprimiert abgelegt werden
 * @param verifyOnRead       Prüfsumme bei jedem {@code retrieve} nachrechnen
 */
public record CacheConfig(
        long maxSizeBytes,
        Duration maxAge,
        StorageType storageType,
        boolean compressionEnabled,
        boolean verifyOnRead) {

    /** 500 MiB */
    public static final long DEFAULT_MAX_SIZE_BYTES = 500L * 1024 * 1024;

    public static final Duration DEFAULT_MAX_AGE = Duration.ofDays(7);

    public CacheConfig {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + maxSizeBytes);
        }
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive: " + maxAge);
        }
        Objects.requireNonNull(storageType, "storageType must not be null");
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE_BYTES, DEFAULT_MAX_AGE, StorageType.DURABLE_KV, true, false);
    }

    public CacheConfig withStorageType(StorageType type) {
        return new CacheConfig(maxSizeBytes, maxAge, type, compressionEnabled, verifyOnRead);
    }

    /**
     * Wendet ein partielles Update an; {@code null}-Felder bleiben unverändert.
     *
     * @param update partielles Update
     * @return neue Konfiguration
     */
    public CacheConfig merge(CacheConfigUpdate update) {
        if (update == null) return this;
        return new CacheConfig(
                update.maxSizeBytes() != null ? update.maxSizeBytes() : maxSizeBytes,
                update.maxAge() != null ? update.maxAge() : maxAge,
                update.storageType() != null ? update.storageType() : storageType,
                update.compressionEnabled() != null ? update.compressionEnabled() : compressionEnabled,
                update.verifyOnRead() != null ? update.verifyOnRead() : verifyOnRead);
    }
}
