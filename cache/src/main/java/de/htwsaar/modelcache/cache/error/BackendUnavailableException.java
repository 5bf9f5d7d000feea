package de.htwsaar.modelcache.cache.error;

import de.htwsaar.modelcache.cache.StorageType;

/**
 * Der gewünschte Storage-Backend-Typ lässt sich in dieser Umgebung nicht initialisieren.
 */
public class BackendUnavailableException extends ModelCacheException {

    private final StorageType storageType;

    public BackendUnavailableException(StorageType storageType, String message, Throwable cause) {
        super("Storage backend " + storageType + " unavailable: " + message, cause);
        this.storageType = storageType;
    }

    public StorageType getStorageType() {
        return storageType;
    }
}
