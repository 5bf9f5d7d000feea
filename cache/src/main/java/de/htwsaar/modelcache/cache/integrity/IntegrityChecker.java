package de.htwsaar.modelcache.cache.integrity;

import de.htwsaar.modelcache.cache.CacheEntry;
import de.htwsaar.modelcache.cache.error.IntegrityCheckException;
import de.htwsaar.modelcache.common.util.Sha256Util;
import java.util.Objects;

/**
 * Berechnet und prüft SHA-256-Prüfsummen von Modell-Payloads.
 */
public class IntegrityChecker {

    /**
     * @param payload Rohdaten
     * @return Prüfsumme als 64-stelliger Hex-String (lowercase)
     */
    public String checksum(byte[] payload) {
        return Sha256Util.sha256Hex(payload);
    }

    public boolean isIntact(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        return Sha256Util.matches(entry.metadata().checksum(), entry.payload());
    }

    /**
     * Prüft, ob der Payload zur gespeicherten Prüfsumme passt.
     *
     * @param entry zu prüfender Eintrag
     * @throws IntegrityCheckException bei Abweichung
     */
    public void verify(CacheEntry entry) {
        if (!isIntact(entry)) {
            throw new IntegrityCheckException(entry.id(), entry.metadata().checksum(), checksum(entry.payload()));
        }
    }
}
