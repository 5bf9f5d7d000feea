package de.htwsaar.modelcache.server.web;

import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.error.CapacityExceededException;
import de.htwsaar.modelcache.cache.error.StorageBackendException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP-Adapter für Modell-Artefakte.
 *
 * <p>Kein Fachcode hier, nur HTTP-Mapping und Fehlerbehandlung. IDs dürfen Schrägstriche
 * enthalten ({@code /api/cache/models/org/bert-base}).</p>
 *
 * <ul>
 *   <li>PUT    /api/cache/models/{id}?version=… – Artefakt speichern</li>
 *   <li>GET    /api/cache/models/{id}           – Artefakt lesen ({@code X-Cache: HIT|MISS})</li>
 *   <li>HEAD   /api/cache/models/{id}           – Existenz prüfen</li>
 *   <li>DELETE /api/cache/models/{id}           – Artefakt entfernen</li>
 *   <li>GET    /api/cache/models                – lebende Einträge auflisten</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/cache/models")
public class ModelArtifactController {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactController.class);

    static final String X_CACHE = "X-Cache";

    private final ModelCache cache;

    /**
     * Constructor Injection.
     *
     * @param cache Model-Cache
     */
    public ModelArtifactController(ModelCache cache) {
        this.cache = cache;
    }

    /**
     * Speichert ein Artefakt (Body als Rohbytes).
     *
     * @param rawId   Modell-ID aus dem Pfad
     * @param version Versionslabel (optional)
     * @param body    Artefakt-Bytes
     * @return 204, 413 wenn das Artefakt das Budget übersteigt
     */
    @PutMapping(value = "/{*id}")
    public ResponseEntity<?> store(
            @PathVariable("id") String rawId,
            @RequestParam(value = "version", defaultValue = "") String version,
            @RequestBody(required = false) byte[] body) {
        String id = modelId(rawId);
        if (id.isEmpty()) return badRequest("model id must not be blank or padded with whitespace");
        try {
            cache.store(id, body == null ? new byte[0] : body, version);
            return ResponseEntity.noContent().build();
        } catch (CapacityExceededException ex) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(Map.of(
                    "id", id,
                    "size", ex.getPayloadSize(),
                    "maxSize", ex.getMaxSize(),
                    "error", ex.getMessage()));
        } catch (StorageBackendException ex) {
            log.warn("Storing '{}' failed: {}", id, ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("id", id, "error", ex.getMessage()));
        }
    }

    /**
     * Liefert ein Artefakt.
     *
     * @param rawId Modell-ID aus dem Pfad
     * @return Bytes mit {@code X-Cache: HIT} oder 404 mit {@code X-Cache: MISS}
     */
    @GetMapping("/{*id}")
    public ResponseEntity<byte[]> retrieve(@PathVariable("id") String rawId) {
        String id = modelId(rawId);
        if (id.isEmpty()) return ResponseEntity.badRequest().build();
        Optional<byte[]> payload = cache.retrieve(id);
        if (payload.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).header(X_CACHE, "MISS").build();
        }
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        h.set(X_CACHE, "HIT");
        return ResponseEntity.ok().headers(h).body(payload.get());
    }

    /**
     * Prüft die Existenz ohne Body. Zählt wie ein Lesezugriff.
     *
     * @param rawId Modell-ID aus dem Pfad
     * @return 200 oder 404
     */
    @RequestMapping(value = "/{*id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> has(@PathVariable("id") String rawId) {
        String id = modelId(rawId);
        if (id.isEmpty()) return ResponseEntity.badRequest().build();
        boolean present = cache.has(id);
        return ResponseEntity.status(present ? HttpStatus.OK : HttpStatus.NOT_FOUND)
                .header(X_CACHE, present ? "HIT" : "MISS")
                .build();
    }

    /**
     * Entfernt ein Artefakt. Mehrfaches Löschen ist unkritisch.
     *
     * @param rawId Modell-ID aus dem Pfad
     * @return Status-Nachricht
     */
    @DeleteMapping("/{*id}")
    public ResponseEntity<Map<String, String>> remove(@PathVariable("id") String rawId) {
        String id = modelId(rawId);
        if (id.isEmpty()) return ResponseEntity.badRequest().build();
        boolean removed = cache.remove(id);
        return ResponseEntity.ok(Map.of("id", id, "status", removed ? "removed" : "not in cache"));
    }

    /** @return Metadaten aller lebenden Einträge, nächster Eviction-Kandidat zuerst */
    @GetMapping
    public ResponseEntity<List<EntryMetadata>> list() {
        return ResponseEntity.ok(cache.list());
    }

    /**
     * Catch-all-Pfadvariablen beginnen mit {@code /}. Die ID wird sonst nicht verändert; leere IDs
     * und IDs mit Leerraum am Rand ergeben {@code ""} und werden vom Aufrufer mit 400 abgewiesen.
     */
    static String modelId(String rawId) {
        if (rawId == null) return "";
        String id = rawId;
        while (id.startsWith("/")) id = id.substring(1);
        if (id.isBlank() || !id.equals(id.strip())) return "";
        return id;
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
