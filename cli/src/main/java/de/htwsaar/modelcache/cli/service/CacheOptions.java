package de.htwsaar.modelcache.cli.service;

import de.htwsaar.modelcache.cache.CacheConfig;
import de.htwsaar.modelcache.cache.StorageType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Aufgelöste Root-Optionen der CLI.
 *
 * @param dir           Cache-Verzeichnis (SQLite-Datei, Blob-Ablage, Statistik)
 * @param storageType   gewünschtes Backend
 * @param maxSizeBytes  Größenbudget
 * @param maxAge        Höchstalter
 * @param verifyOnRead  Prüfsumme bei jedem Lesen nachrechnen
 */
public record CacheOptions(
        Path dir, StorageType storageType, long maxSizeBytes, Duration maxAge, boolean verifyOnRead) {

    public CacheOptions {
        Objects.requireNonNull(dir, "dir must not be null");
        Objects.requireNonNull(storageType, "storageType must not be null");
        Objects.requireNonNull(maxAge, "maxAge must not be null");
    }

    /**
     * @return Cache-Konfiguration; Kompression bleibt beim Standard
     * @throws IllegalArgumentException bei ungültigem Budget oder Alter
     */
    public CacheConfig toConfig() {
        return new CacheConfig(maxSizeBytes, maxAge, storageType, true, verifyOnRead);
    }
}
