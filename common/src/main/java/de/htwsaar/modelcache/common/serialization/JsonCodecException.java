package de.htwsaar.modelcache.common.serialization;

/**
 * Wird geworfen, wenn ein Objekt nicht nach JSON (oder zurück) übersetzt werden kann.
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
