package de.htwsaar.modelcache.cache;

import java.util.Objects;

/**
 * Metadaten eines Cache-Eintrags ohne Payload.
 *
 * <p>Reicht für Eviction, Ablaufprüfung und Auflistung; der Payload wird nur bei Bedarf geladen.</p>
 *
 * @param id               Modell-ID (eindeutig)
 * @param size             Payload-Größe in Bytes
 * @param createdAtMs      Zeitpunkt des Speicherns in ms seit Epoch
 * @param lastAccessedAtMs letzter erfolgreicher Zugriff in ms seit Epoch
 * @param version          vom Aufrufer vergebenes Versionslabel (opak)
 * @param checksum         SHA-256 des Payloads als Hex-String
 */
public record EntryMetadata(
        String id, long size, long createdAtMs, long lastAccessedAtMs, String version, String checksum) {

    public EntryMetadata {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (lastAccessedAtMs < createdAtMs) {
            throw new IllegalArgumentException("lastAccessedAtMs must not be before createdAtMs");
        }
        version = Objects.requireNonNullElse(version, "");
        Objects.requireNonNull(checksum, "checksum must not be null");
    }

    /**
     * Kopie mit neuem Zugriffszeitpunkt; fällt nie vor {@link #createdAtMs()} zurück.
     *
     * @param accessedAtMs Zugriffszeitpunkt
     * @return aktualisierte Metadaten
     */
    public EntryMetadata withLastAccessed(long accessedAtMs) {
        return new EntryMetadata(id, size, createdAtMs, Math.max(createdAtMs, accessedAtMs), version, checksum);
    }

    /**
     * Alter des Eintrags relativ zu {@code nowMs}.
     *
     * @param nowMs aktueller Zeitpunkt
     * @return Alter in ms
     */
    public long ageMs(long nowMs) {
        return nowMs - createdAtMs;
    }
}
