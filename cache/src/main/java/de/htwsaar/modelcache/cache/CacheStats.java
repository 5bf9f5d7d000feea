package de.htwsaar.modelcache.cache;

/**
 * Unveränderlicher Snapshot der Cache-Statistik.
 *
 * @param totalSize     Summe der Eintragsgrößen in Bytes
 * @param entryCount    Anzahl lebender Einträge
 * @param hitCount      Treffer seit dem letzten {@code clear}
 * @param missCount     Fehlzugriffe seit dem letzten {@code clear}
 * @param hitRate       Trefferquote zwischen 0 und 1
 * @param missRate      {@code 1 - hitRate}, solange es mindestens einen Zugriff gab
 * @param evictionCount durch Eviction oder Ablauf entfernte Einträge
 */
public record CacheStats(
        long totalSize,
        long entryCount,
        long hitCount,
        long missCount,
        double hitRate,
        double missRate,
        long evictionCount) {

    /**
     * Baut einen Snapshot und leitet die Quoten aus den Zählern ab.
     * Ohne Zugriffe sind beide Quoten 0.
     */
    public static CacheStats of(long totalSize, long entryCount, long hits, long misses, long evictions) {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        double missRate = lookups == 0 ? 0.0 : 1.0 - hitRate;
        return new CacheStats(totalSize, entryCount, hits, misses, hitRate, missRate, evictions);
    }
}
