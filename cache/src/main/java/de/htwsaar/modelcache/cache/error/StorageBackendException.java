package de.htwsaar.modelcache.cache.error;

/**
 * Lese- oder Schreibfehler eines bereits geöffneten Storage-Backends.
 */
public class StorageBackendException extends ModelCacheException {

    public StorageBackendException(String message) {
        super(message);
    }

    public StorageBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
