package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.error.BackendUnavailableException;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Öffnet Backends anhand ihres {@link StorageType}.
 *
 * <p>Die Menge der Varianten ist geschlossen; neue Typen erfordern eine Erweiterung dieses
 * {@code switch}. Der Fallback auf {@link StorageType#MEMORY} ist ein expliziter Zustandswechsel
 * und wird geloggt.</p>
 */
public class StorageBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageBackendFactory.class);

    private final StorageSettings settings;

    public StorageBackendFactory(StorageSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public StorageSettings settings() {
        return settings;
    }

    /**
     * Öffnet genau den angeforderten Typ.
     *
     * @param type gewünschtes Backend
     * @return geöffnetes Backend
     * @throws BackendUnavailableException wenn es sich nicht initialisieren lässt
     */
    public StorageBackend open(StorageType type) {
        Objects.requireNonNull(type, "type must not be null");
        return switch (type) {
            case MEMORY -> new InMemoryStorageBackend();
            case DURABLE_KV -> SqliteStorageBackend.open(settings.sqliteFile());
            case BLOB_CACHE -> openBlobCache();
        };
    }

    /**
     * Öffnet den angeforderten Typ und weicht bei Fehlern auf den Arbeitsspeicher aus.
     *
     * @param type gewünschtes Backend
     * @return Auswahl inklusive Fallback-Kennzeichen
     */
    public BackendSelection openWithFallback(StorageType type) {
        try {
            return new BackendSelection(type, open(type), false);
        } catch (BackendUnavailableException e) {
            log.warn("Storage backend {} unavailable, falling back to MEMORY: {}", type, e.getMessage());
            return new BackendSelection(type, new InMemoryStorageBackend(), true);
        }
    }

    private StorageBackend openBlobCache() {
        try {
            BlobCacheBackend backend = new BlobCacheBackend(new FileSystemBlobStore(settings.blobRoot()));
            log.info("Opened blob model cache at {}", settings.blobRoot().toAbsolutePath());
            return backend;
        } catch (IOException e) {
            throw new BackendUnavailableException(StorageType.BLOB_CACHE, settings.blobRoot().toString(), e);
        }
    }
}
