package de.htwsaar.modelcache.cache.storage;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port zu einem Request/Response-artigen Blob-Store (Schlüssel sind Pfade wie {@code /models/bert}).
 *
 * <p>Der Store kennt keine strukturierten Felder; Metadaten reisen als Header neben dem Body.</p>
 */
public interface BlobStore extends AutoCloseable {

    /**
     * Legt einen Blob unter dem Pfad ab und ersetzt einen vorhandenen vollständig.
     */
    void put(String path, StoredBlob blob) throws IOException;

    Optional<StoredBlob> match(String path) throws IOException;

    /**
     * Liest nur die Header, ohne den Body zu laden.
     */
    Optional<Map<String, String>> matchHeaders(String path) throws IOException;

    /**
     * @return {@code true} wenn unter dem Pfad etwas gelöscht wurde
     */
    boolean delete(String path) throws IOException;

    /**
     * @return alle Pfade, unter denen aktuell ein vollständiger Blob liegt
     */
    List<String> keys() throws IOException;

    @Override
    void close();
}
