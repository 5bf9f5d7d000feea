package de.htwsaar.modelcache.server.web;

import de.htwsaar.modelcache.cache.CacheConfig;
import de.htwsaar.modelcache.cache.CacheConfigUpdate;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.error.BackendUnavailableException;
import java.time.Duration;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Live-Konfiguration des Caches.
 *
 * <ul>
 *   <li>GET   /api/cache/admin/config – aktuelle Konfiguration und aktives Backend</li>
 *   <li>PATCH /api/cache/admin/config – partielles Update</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/cache/admin/config")
public class CacheAdminConfigController {

    private final ModelCache cache;

    /**
     * Constructor Injection.
     *
     * @param cache Model-Cache
     */
    public CacheAdminConfigController(ModelCache cache) {
        this.cache = cache;
    }

    /** @return aktuelle Konfiguration */
    @GetMapping
    public ResponseEntity<ConfigView> getConfig() {
        return ResponseEntity.ok(ConfigView.of(cache.getConfig(), cache));
    }

    /**
     * Partielles Config-Update (nur gesetzte Felder werden übernommen).
     *
     * @param dto partielles Konfigurations-DTO (Felder können {@code null} sein)
     * @return aktualisierte Konfiguration, 400 bei ungültigen Werten, 503 wenn das Backend nicht öffnet
     */
    @PatchMapping
    public ResponseEntity<?> patchConfig(@RequestBody ConfigPatchDto dto) {
        try {
            CacheConfig updated = cache.updateConfig(dto.toUpdate());
            return ResponseEntity.ok(ConfigView.of(updated, cache));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
        } catch (BackendUnavailableException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "storageType", ex.getStorageType().name(),
                    "error", ex.getMessage()));
        }
    }

    /**
     * Sicht auf die Konfiguration; das Höchstalter in Millisekunden.
     *
     * @param maxSizeBytes       Größenbudget
     * @param maxAgeMs           Höchstalter in ms
     * @param storageType        konfiguriertes Backend
     * @param compressionEnabled Kompressions-Hinweis
     * @param verifyOnRead       Prüfsumme beim Lesen
     * @param activeStorageType  tatsächlich aktives Backend
     * @param fallbackActive     {@code true} nach einem Fallback auf MEMORY
     */
    public record ConfigView(
            long maxSizeBytes,
            long maxAgeMs,
            StorageType storageType,
            boolean compressionEnabled,
            boolean verifyOnRead,
            StorageType activeStorageType,
            boolean fallbackActive) {

        static ConfigView of(CacheConfig c, ModelCache cache) {
            return new ConfigView(
                    c.maxSizeBytes(),
                    c.maxAge().toMillis(),
                    c.storageType(),
                    c.compressionEnabled(),
                    c.verifyOnRead(),
                    cache.activeStorageType(),
                    cache.isFallbackActive());
        }
    }

    /**
     * DTO für partielles Config-Update (alle Felder optional / nullable).
     *
     * @param maxSizeBytes       neues Budget oder {@code null}
     * @param maxAgeMs           neues Höchstalter in ms oder {@code null}
     * @param storageType        neues Backend (z. B. {@code blob-cache}) oder {@code null}
     * @param compressionEnabled neuer Kompressions-Hinweis oder {@code null}
     * @param verifyOnRead       Prüfsumme beim Lesen oder {@code null}
     */
    public record ConfigPatchDto(
            Long maxSizeBytes, Long maxAgeMs, String storageType, Boolean compressionEnabled, Boolean verifyOnRead) {

        CacheConfigUpdate toUpdate() {
            return new CacheConfigUpdate(
                    maxSizeBytes,
                    maxAgeMs == null ? null : Duration.ofMillis(maxAgeMs),
                    storageType == null ? null : StorageType.parse(storageType),
                    compressionEnabled,
                    verifyOnRead);
        }
    }
}
