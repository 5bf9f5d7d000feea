package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.CacheEntry;
import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.error.StorageBackendException;
import de.htwsaar.modelcache.common.serialization.JacksonCodec;
import de.htwsaar.modelcache.common.serialization.JsonCodecException;
import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend über einen {@link BlobStore}: jeder Eintrag liegt unter {@code /models/{id}}.
 *
 * <p>Der Store kennt keine strukturierten Felder, daher reisen die {@link EntryMetadata} als JSON im
 * Header {@value #METADATA_HEADER} neben dem Body. Ein Blob ohne diesen Header gilt als nicht
 * vorhanden. Zugriffszeitpunkte werden durch vollständiges Neuschreiben aktualisiert.</p>
 */
public final class BlobCacheBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(BlobCacheBackend.class);

    public static final String METADATA_HEADER = "X-Model-Metadata";
    static final String KEY_PREFIX = "/models/";

    private final BlobStore store;

    public BlobCacheBackend(BlobStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Synthetischer Pfad einer Modell-ID. Die ID wird URL-kodiert, Punkte zusätzlich maskiert,
     * damit jede ID genau ein Pfadsegment ergibt.
     *
     * @param id Modell-ID
     * @return Pfad wie {@code /models/bert-base}
     */
    static String keyFor(String id) {
        return KEY_PREFIX + URLEncoder.encode(id, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    static Optional<String> idFromKey(String key) {
        if (key == null || !key.startsWith(KEY_PREFIX)) return Optional.empty();
        String encoded = key.substring(KEY_PREFIX.length());
        if (encoded.isEmpty() || encoded.contains("/")) return Optional.empty();
        return Optional.of(URLDecoder.decode(encoded, StandardCharsets.UTF_8));
    }

    @Override
    public StorageType type() {
        return StorageType.BLOB_CACHE;
    }

    @Override
    public void put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Map<String, String> headers = Map.of(
                METADATA_HEADER, JacksonCodec.toJson(entry.metadata()),
                "Content-Type", "application/octet-stream",
                "Content-Length", Long.toString(entry.size()));
        try {
            store.put(keyFor(entry.id()), new StoredBlob(entry.payload(), headers));
        } catch (IOException e) {
            throw new StorageBackendException("Blob store failed to put '" + entry.id() + "'", e);
        }
    }

    @Override
    public Optional<CacheEntry> get(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        Optional<StoredBlob> blob;
        try {
            blob = store.match(keyFor(id));
        } catch (IOException e) {
            throw new StorageBackendException("Blob store failed to read '" + id + "'", e);
        }
        if (blob.isEmpty()) return Optional.empty();

        Optional<EntryMetadata> metadata = parseMetadata(id, blob.get().headers());
        if (metadata.isEmpty()) return Optional.empty();

        byte[] body = blob.get().body();
        if (body.length != metadata.get().size()) {
            throw new StorageBackendException("Blob for '" + id + "' has " + body.length
                    + " bytes but metadata records " + metadata.get().size());
        }
        return Optional.of(new CacheEntry(metadata.get(), body));
    }

    @Override
    public Optional<EntryMetadata> getMetadata(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        try {
            return store.matchHeaders(keyFor(id)).flatMap(h -> parseMetadata(id, h));
        } catch (IOException e) {
            throw new StorageBackendException("Blob store failed to read headers of '" + id + "'", e);
        }
    }

    @Override
    public boolean delete(String id) {
        if (id == null || id.isBlank()) return false;
        try {
            return store.delete(keyFor(id));
        } catch (IOException e) {
            throw new StorageBackendException("Blob store failed to delete '" + id + "'", e);
        }
    }

    @Override
    public List<EntryMetadata> listAll() {
        List<String> keys;
        try {
            keys = store.keys();
        } catch (IOException e) {
            throw new StorageBackendException("Blob store failed to list keys", e);
        }
        List<EntryMetadata> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            Optional<String> id = idFromKey(key);
            if (id.isEmpty()) continue;
            // Einträge, die während des Listens verschwinden, fallen einfach heraus
            getMetadata(id.get()).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public void close() {
        store.close();
    }

    private static Optional<EntryMetadata> parseMetadata(String id, Map<String, String> headers) {
        String raw = headers.get(METADATA_HEADER);
        if (raw == null || raw.isBlank()) {
            log.debug("Blob for '{}' carries no {} header, treating as absent", id, METADATA_HEADER);
            return Optional.empty();
        }
        try {
            EntryMetadata metadata = JacksonCodec.fromJson(raw, EntryMetadata.class);
            if (!id.equals(metadata.id())) {
                throw new StorageBackendException(
                        "Blob stored under '" + id + "' describes '" + metadata.id() + "'");
            }
            return Optional.of(metadata);
        } catch (JsonCodecException e) {
            throw new StorageBackendException("Unreadable metadata header for '" + id + "'", e);
        }
    }
}
