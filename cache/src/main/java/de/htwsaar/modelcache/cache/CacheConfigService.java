package de.htwsaar.modelcache.cache;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-sicherer Halter der aktiven {@link CacheConfig}.
 *
 * <p>Alle Komponenten lesen die Konfiguration pro Operation über {@link #current()};
 * Änderungen wirken dadurch nur auf nachfolgende Operationen.</p>
 */
public class CacheConfigService {

    private final AtomicReference<CacheConfig> ref;

    /**
     * @param initial Startkonfiguration (darf nicht {@code null} sein)
     */
    public CacheConfigService(CacheConfig initial) {
        this.ref = new AtomicReference<>(Objects.requireNonNull(initial, "initial config must not be null"));
    }

    public CacheConfig current() {
        return ref.get();
    }

    /**
     * Partielles Update (atomisch).
     *
     * @param update nur gesetzte Felder werden übernommen
     * @return die neue Konfiguration
     * @throws IllegalArgumentException wenn das Ergebnis ungültig wäre; die alte Konfiguration bleibt dann aktiv
     */
    public CacheConfig patch(CacheConfigUpdate update) {
        return ref.updateAndGet(cur -> cur.merge(update));
    }

    /**
     * Setzt das tatsächlich aktive Backend, z. B. nach einem Fallback.
     *
     * @param type aktiver Typ
     * @return die neue Konfiguration
     */
    public CacheConfig markActiveStorage(StorageType type) {
        return ref.updateAndGet(cur -> cur.withStorageType(type));
    }
}
