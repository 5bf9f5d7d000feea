package de.htwsaar.modelcache.cache.expiry;

/**
 * Ergebnis eines Sweep-Durchlaufs.
 *
 * @param scanned geprüfte Einträge
 * @param expired entfernte Einträge
 * @param failed  Einträge, deren Prüfung oder Löschung fehlschlug
 */
public record SweepResult(int scanned, int expired, int failed) {

    public static final SweepResult EMPTY = new SweepResult(0, 0, 0);
}
