package de.htwsaar.modelcache.cache.expiry;

import java.time.Duration;

/**
 * Ablaufregel für Cache-Einträge: abgelaufen ist, was strikt älter als {@code maxAge} ist.
 */
public final class ExpiryRule {

    private ExpiryRule() {}

    /**
     * @param createdAtMs Erstellzeitpunkt
     * @param nowMs       aktueller Zeitpunkt
     * @param maxAge      Höchstalter
     * @return {@code true} wenn {@code now - createdAt > maxAge}
     */
    public static boolean isExpired(long createdAtMs, long nowMs, Duration maxAge) {
        return nowMs - createdAtMs > maxAge.toMillis();
    }
}
