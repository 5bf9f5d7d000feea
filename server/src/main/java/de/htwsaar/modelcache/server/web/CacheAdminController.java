package de.htwsaar.modelcache.server.web;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.expiry.SweepResult;
import de.htwsaar.modelcache.cache.integrity.IntegrityStatus;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Cache-Wartung.
 *
 * <ul>
 *   <li>DELETE /api/cache/admin/all          – gesamten Cache leeren</li>
 *   <li>POST   /api/cache/admin/sweep        – abgelaufene Einträge sofort entfernen</li>
 *   <li>POST   /api/cache/admin/verify/{id}  – Prüfsumme eines Eintrags nachrechnen</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/cache/admin")
public class CacheAdminController {

    private final ModelCache cache;

    public CacheAdminController(ModelCache cache) {
        this.cache = cache;
    }

    /**
     * Leert den gesamten Cache und setzt die Statistik zurück.
     *
     * @return Bestätigung mit Anzahl entfernter Einträge
     */
    @DeleteMapping("/all")
    public ResponseEntity<Map<String, Object>> clearAll() {
        int removed = cache.clear();
        return ResponseEntity.ok(Map.of("status", "cache cleared", "removed", removed));
    }

    /** @return Zähler des Sweep-Durchlaufs */
    @PostMapping("/sweep")
    public ResponseEntity<SweepResult> sweep() {
        return ResponseEntity.ok(cache.sweepExpired());
    }

    /**
     * Prüft die Integrität eines Eintrags. Korrupte Einträge werden dabei entfernt.
     *
     * @param rawId Modell-ID aus dem Pfad
     * @return 200 mit Ergebnis, 404 wenn kein Eintrag existiert
     */
    @PostMapping("/verify/{*id}")
    public ResponseEntity<Map<String, Object>> verify(@PathVariable("id") String rawId) {
        String id = ModelArtifactController.modelId(rawId);
        if (id.isEmpty()) return ResponseEntity.badRequest().build();
        IntegrityStatus status = cache.verify(id);
        Map<String, Object> body = Map.of("id", id, "status", status.name(), "intact", status == IntegrityStatus.INTACT);
        HttpStatus http = status == IntegrityStatus.ABSENT ? HttpStatus.NOT_FOUND : HttpStatus.OK;
        return ResponseEntity.status(http).body(body);
    }
}
