package de.htwsaar.modelcache.server.web;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.modelcache.cache.CacheConfig;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.StorageType;
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

class ModelArtifactControllerTest {

    @TempDir
    Path tempDir;

    private ModelCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cache = ModelCache.open(
                new CacheConfig(1_000, Duration.ofDays(1), StorageType.MEMORY, true, false),
                new StorageBackendFactory(StorageSettings.under(tempDir)),
                new InMemoryStatsRepository(),
                Clock.systemUTC(),
                Duration.ofHours(1));
        mockMvc = MockMvcBuilders.standaloneSetup(new ModelArtifactController(cache))
                .setPatternParser(new PathPatternParser())
                .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void storedArtifactIsServedAsHit() throws Exception {
        byte[] payload = {10, 20, 30, 40};

        mockMvc.perform(put("/api/cache/models/bert-base")
                        .param("version", "1.0")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(payload))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/cache/models/bert-base"))
                .andExpect(status().isOk())
                .andExpect(header().string(ModelArtifactController.X_CACHE, "HIT"))
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(content().bytes(payload));
    }

    @Test
    void idsMayContainSlashes() throws Exception {
        mockMvc.perform(put("/api/cache/models/org/sentiment/v2")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[] {1}))
                .andExpect(status().isNoContent());

        assertTrue(cache.list().stream().anyMatch(m -> m.id().equals("org/sentiment/v2")));
        mockMvc.perform(get("/api/cache/models/org/sentiment/v2")).andExpect(status().isOk());
    }

    @Test
    void unknownArtifactIsMiss() throws Exception {
        mockMvc.perform(get("/api/cache/models/nope"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(ModelArtifactController.X_CACHE, "MISS"));

        assertEquals(1, cache.getStats().missCount());
    }

    @Test
    void oversizedArtifactIsRejectedWith413() throws Exception {
        mockMvc.perform(put("/api/cache/models/huge")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[1_001]))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.id").value("huge"))
                .andExpect(jsonPath("$.size").value(1_001))
                .andExpect(jsonPath("$.maxSize").value(1_000));

        assertEquals(0, cache.getStats().entryCount());
    }

    @Test
    void headReflectsPresence() throws Exception {
        cache.store("m1", new byte[] {1, 2}, "1");

        mockMvc.perform(head("/api/cache/models/m1")).andExpect(status().isOk());
        mockMvc.perform(head("/api/cache/models/m2")).andExpect(status().isNotFound());
    }

    @Test
    void deleteIsIdempotent() throws Exception {
        cache.store("m1", new byte[] {1, 2}, "1");

        mockMvc.perform(delete("/api/cache/models/m1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("removed"));
        mockMvc.perform(delete("/api/cache/models/m1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not in cache"));
    }

    @Test
    void listShowsMetadataWithoutPayload() throws Exception {
        cache.store("m1", new byte[] {1, 2, 3}, "1.2");

        mockMvc.perform(get("/api/cache/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m1"))
                .andExpect(jsonPath("$[0].size").value(3))
                .andExpect(jsonPath("$[0].version").value("1.2"))
                .andExpect(content().string(containsString("checksum")));
    }

    @Test
    void catchAllPrefixIsStripped() {
        assertEquals("org/model", ModelArtifactController.modelId("/org/model"));
        assertEquals("", ModelArtifactController.modelId("/"));
        assertEquals("", ModelArtifactController.modelId(null));
    }

    @Test
    void paddedIdsAreRejectedInsteadOfRewritten() throws Exception {
        assertEquals("", ModelArtifactController.modelId("/ padded "));
        assertEquals("", ModelArtifactController.modelId("/  "));
        assertEquals("org/a b", ModelArtifactController.modelId("/org/a b"));

        mockMvc.perform(put("/api/cache/models/{id}", " padded ")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[] {1}))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("whitespace")));
        mockMvc.perform(get("/api/cache/models/{id}", "padded ")).andExpect(status().isBadRequest());

        assertTrue(cache.list().isEmpty());
    }
}
