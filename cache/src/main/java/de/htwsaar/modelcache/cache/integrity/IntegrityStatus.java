package de.htwsaar.modelcache.cache.integrity;

/**
 * Ergebnis einer expliziten Integritätsprüfung.
 */
public enum IntegrityStatus {
    /** Payload passt zur gespeicherten Prüfsumme. */
    INTACT,
    /** Abweichung; der Eintrag wurde entfernt. */
    CORRUPT,
    /** Kein (gültiger) Eintrag unter der ID. */
    ABSENT
}
