package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.StorageType;
import java.util.Objects;

/**
 * Ergebnis der Backend-Auswahl.
 *
 * @param requested angeforderter Typ
 * @param backend   tatsächlich geöffnetes Backend
 * @param fallback  {@code true} wenn statt {@code requested} auf {@link StorageType#MEMORY} ausgewichen wurde
 */
public record BackendSelection(StorageType requested, StorageBackend backend, boolean fallback) {

    public BackendSelection {
        Objects.requireNonNull(requested, "requested must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
    }

    public StorageType active() {
        return backend.type();
    }
}
