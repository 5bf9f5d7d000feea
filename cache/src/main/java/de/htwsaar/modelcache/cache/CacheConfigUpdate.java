package de.htwsaar.modelcache.cache;

import java.time.Duration;

/**
 * Partielles Konfigurations-Update: nur nicht-{@code null}-Felder werden übernommen.
 *
 * @param maxSizeBytes       neues Budget oder {@code null}
 * @param maxAge             neues Höchstalter oder {@code null}
 * @param storageType        neues Backend oder {@code null}
 * @param compressionEnabled neuer Kompressions-Hinweis oder {@code null}
 * @param verifyOnRead       Prüfsummenkontrolle beim Lesen oder {@code null}
 */
public record CacheConfigUpdate(
        Long maxSizeBytes,
        Duration maxAge,
        StorageType storageType,
        Boolean compressionEnabled,
        Boolean verifyOnRead) {

    public static CacheConfigUpdate maxSize(long bytes) {
        return new CacheConfigUpdate(bytes, null, null, null, null);
    }

    public static CacheConfigUpdate maxAge(Duration maxAge) {
        return new CacheConfigUpdate(null, maxAge, null, null, null);
    }

    public static CacheConfigUpdate storageType(StorageType type) {
        return new CacheConfigUpdate(null, null, type, null, null);
    }

    public static CacheConfigUpdate verifyOnRead(boolean verify) {
        return new CacheConfigUpdate(null, null, null, null, verify);
    }
}
