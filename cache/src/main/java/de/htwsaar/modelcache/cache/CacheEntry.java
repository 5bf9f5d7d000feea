package de.htwsaar.modelcache.cache;

import java.util.Objects;

/**
 * Gespeicherte Einheit des Caches: Metadaten plus opaker Payload.
 *
 * @param metadata Metadaten (Größe entspricht immer der Payload-Länge)
 * @param payload  Artefakt-Bytes, werden vom Cache nie interpretiert
 */
public record CacheEntry(EntryMetadata metadata, byte[] payload) {

    public CacheEntry {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (payload.length != metadata.size()) {
            throw new IllegalArgumentException("payload length " + payload.length
                    + " does not match recorded size " + metadata.size() + " for '" + metadata.id() + "'");
        }
    }

    public String id() {
        return metadata.id();
    }

    public long size() {
        return metadata.size();
    }

    /**
     * Kopie mit aktualisiertem Zugriffszeitpunkt; der Payload bleibt unverändert.
     */
    public CacheEntry withLastAccessed(long accessedAtMs) {
        return new CacheEntry(metadata.withLastAccessed(accessedAtMs), payload);
    }
}
