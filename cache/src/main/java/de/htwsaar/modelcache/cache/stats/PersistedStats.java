package de.htwsaar.modelcache.cache.stats;

/**
 * Persistierte Form der Statistik.
 *
 * @param hitCount      Treffer
 * @param missCount     Fehlzugriffe
 * @param totalSize     Summe der Eintragsgrößen
 * @param entryCount    Anzahl Einträge
 * @param evictionCount entfernte Einträge durch Eviction oder Ablauf
 */
public record PersistedStats(long hitCount, long missCount, long totalSize, long entryCount, long evictionCount) {

    public static final PersistedStats ZERO = new PersistedStats(0, 0, 0, 0, 0);
}
