package de.htwsaar.modelcache.cache;

/**
 * Unterstützte Storage-Backends des Model-Caches.
 */
public enum StorageType {
    /** Prozesslokale Map, überlebt keinen Neustart; Fallback für alle anderen Typen. */
    MEMORY,
    /** Transaktionaler Key-Value-Store auf Platte (SQLite). */
    DURABLE_KV,
    /** Request/Response-artiger Blob-Store mit Metadaten im Header. */
    BLOB_CACHE;

    /**
     * Parst einen Konfigurationswert tolerant ({@code durable-kv}, {@code DURABLE_KV}, ...).
     *
     * @param value Rohwert
     * @return passender Typ
     * @throws IllegalArgumentException bei unbekanntem Wert
     */
    public static StorageType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("storage type must not be blank");
        }
        return StorageType.valueOf(value.trim().replace('-', '_').toUpperCase());
    }
}
