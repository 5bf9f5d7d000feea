package de.htwsaar.modelcache.cache.storage;

import java.util.Map;
import java.util.Objects;

/**
 * Antwort-artiges Objekt eines {@link BlobStore}: Body plus Header.
 *
 * @param body    Rohbytes
 * @param headers Header (unveränderliche Kopie)
 */
public record StoredBlob(byte[] body, Map<String, String> headers) {

    public StoredBlob {
        Objects.requireNonNull(body, "body must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
