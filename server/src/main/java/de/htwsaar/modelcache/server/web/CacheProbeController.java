package de.htwsaar.modelcache.server.web;

import de.htwsaar.modelcache.cache.ModelCache;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes des Cache-Servers.
 */
@RestController
@RequestMapping("/api/cache")
public class CacheProbeController {

    private final ModelCache cache;

    public CacheProbeController(ModelCache cache) {
        this.cache = cache;
    }

    /** @return HTTP 200 "ok" */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /** @return HTTP 200 mit aktivem Backend; {@code degraded} nach einem Fallback */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        return ResponseEntity.ok(Map.of(
                "status", cache.isFallbackActive() ? "degraded" : "ready",
                "storage", cache.activeStorageType().name(),
                "sweeper", cache.isSweeperRunning()));
    }
}
