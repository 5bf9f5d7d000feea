package de.htwsaar.modelcache.server.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.modelcache.cache.CacheConfig;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.error.BackendUnavailableException;
import de.htwsaar.modelcache.cache.stats.InMemoryStatsRepository;
import de.htwsaar.modelcache.cache.storage.StorageBackendFactory;
import de.htwsaar.modelcache.cache.storage.StorageSettings;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.util.pattern.PathPatternParser;

class CacheAdminControllerTest {

    @TempDir
    Path tempDir;

    private ModelCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cache = ModelCache.open(
                new CacheConfig(10_000, Duration.ofDays(1), StorageType.MEMORY, true, false),
                new StorageBackendFactory(StorageSettings.under(tempDir)),
                new InMemoryStatsRepository(),
                Clock.systemUTC(),
                Duration.ofHours(1));
        mockMvc = standalone(cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private static MockMvc standalone(ModelCache cache) {
        return MockMvcBuilders.standaloneSetup(
                        new CacheAdminController(cache),
                        new CacheAdminStatsController(cache),
                        new CacheAdminConfigController(cache),
                        new CacheProbeController(cache))
                .setPatternParser(new PathPatternParser())
                .build();
    }

    @Test
    void statsReflectCacheActivity() throws Exception {
        cache.store("m1", new byte[100], "1");
        cache.retrieve("m1");
        cache.retrieve("m1");
        cache.retrieve("m1");
        cache.retrieve("missing");

        mockMvc.perform(get("/api/cache/admin/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSize").value(100))
                .andExpect(jsonPath("$.entryCount").value(1))
                .andExpect(jsonPath("$.hitCount").value(3))
                .andExpect(jsonPath("$.missCount").value(1))
                .andExpect(jsonPath("$.hitRate").value(0.75));
    }

    @Test
    void clearAllEmptiesTheCache() throws Exception {
        cache.store("a", new byte[10], "1");
        cache.store("b", new byte[10], "1");

        mockMvc.perform(delete("/api/cache/admin/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));

        mockMvc.perform(get("/api/cache/admin/stats")).andExpect(jsonPath("$.entryCount").value(0));
    }

    @Test
    void sweepReportsCounters() throws Exception {
        cache.store("fresh", new byte[1], "1");

        mockMvc.perform(post("/api/cache/admin/sweep"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scanned").value(1))
                .andExpect(jsonPath("$.expired").value(0))
                .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    void verifyReportsIntactOrAbsent() throws Exception {
        cache.store("org/m1", new byte[] {1, 2, 3}, "1");

        mockMvc.perform(post("/api/cache/admin/verify/org/m1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INTACT"))
                .andExpect(jsonPath("$.intact").value(true));

        mockMvc.perform(post("/api/cache/admin/verify/unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("ABSENT"));
    }

    @Test
    void configCanBeReadAndPatched() throws Exception {
        mockMvc.perform(get("/api/cache/admin/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxSizeBytes").value(10_000))
                .andExpect(jsonPath("$.maxAgeMs").value(86_400_000))
                .andExpect(jsonPath("$.activeStorageType").value("MEMORY"));

        mockMvc.perform(patch("/api/cache/admin/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxSizeBytes\":2000,\"verifyOnRead\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxSizeBytes").value(2_000))
                .andExpect(jsonPath("$.verifyOnRead").value(true))
                .andExpect(jsonPath("$.maxAgeMs").value(86_400_000));
    }

    @Test
    void storageTypeChangeSwitchesBackend() throws Exception {
        mockMvc.perform(patch("/api/cache/admin/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"storageType\":\"blob-cache\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storageType").value("BLOB_CACHE"))
                .andExpect(jsonPath("$.activeStorageType").value("BLOB_CACHE"));
    }

    @Test
    void invalidPatchIsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/cache/admin/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxSizeBytes\":-5}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(patch("/api/cache/admin/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"storageType\":\"tape\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unavailableBackendOnPatchIs503() throws Exception {
        ModelCache failing = mock(ModelCache.class);
        when(failing.updateConfig(any()))
                .thenThrow(new BackendUnavailableException(StorageType.DURABLE_KV, "disk gone", null));

        standalone(failing).perform(patch("/api/cache/admin/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"storageType\":\"durable-kv\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.storageType").value("DURABLE_KV"));
    }

    @Test
    void probesAnswer() throws Exception {
        mockMvc.perform(get("/api/cache/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("ok"));
        mockMvc.perform(get("/api/cache/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.storage").value("MEMORY"));
    }
}
