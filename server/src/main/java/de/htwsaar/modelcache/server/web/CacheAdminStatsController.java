package de.htwsaar.modelcache.server.web;

import de.htwsaar.modelcache.cache.CacheStats;
import de.htwsaar.modelcache.cache.ModelCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-API für Cache-Statistiken ({@code GET /api/cache/admin/stats}).
 */
@RestController
@RequestMapping("/api/cache/admin/stats")
public class CacheAdminStatsController {

    private final ModelCache cache;

    public CacheAdminStatsController(ModelCache cache) {
        this.cache = cache;
    }

    /** @return Statistik-Snapshot */
    @GetMapping
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(cache.getStats());
    }
}
