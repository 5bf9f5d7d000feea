package de.htwsaar.modelcache.cache.error;

/**
 * Basisklasse aller fachlichen Fehler des Model-Caches.
 *
 * <p>Cache-Misses sind <b>keine</b> Fehler und werden als leeres {@code Optional} geliefert.</p>
 */
public class ModelCacheException extends RuntimeException {

    public ModelCacheException(String message) {
        super(message);
    }

    public ModelCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
