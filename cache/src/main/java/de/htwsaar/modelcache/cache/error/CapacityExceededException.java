package de.htwsaar.modelcache.cache.error;

/**
 * Das Artefakt ist allein größer als das konfigurierte Cache-Budget.
 * Keine Eviction kann hier helfen; der Aufrufer muss das Budget erhöhen oder das Artefakt ablehnen.
 */
public class CapacityExceededException extends ModelCacheException {

    private final long payloadSize;
    private final long maxSize;

    /**
     * @param id          Modell-ID des abgelehnten Artefakts
     * @param payloadSize Größe des Artefakts in Bytes
     * @param maxSize     konfiguriertes Budget in Bytes
     */
    public CapacityExceededException(String id, long payloadSize, long maxSize) {
        super("Artifact '" + id + "' has " + payloadSize + " bytes, cache budget is " + maxSize + " bytes");
        this.payloadSize = payloadSize;
        this.maxSize = maxSize;
    }

    public long getPayloadSize() {
        return payloadSize;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
