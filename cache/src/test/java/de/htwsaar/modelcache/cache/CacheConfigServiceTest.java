package de.htwsaar.modelcache.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CacheConfigServiceTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CacheConfig config = CacheConfig.defaults();

        assertEquals(500L * 1024 * 1024, config.maxSizeBytes());
        assertEquals(Duration.ofDays(7), config.maxAge());
        assertEquals(StorageType.DURABLE_KV, config.storageType());
        assertTrue(config.compressionEnabled());
        assertFalse(config.verifyOnRead());
    }

    @Test
    void patchChangesOnlyGivenFields() {
        CacheConfigService service = new CacheConfigService(CacheConfig.defaults());

        CacheConfig next = service.patch(CacheConfigUpdate.maxAge(Duration.ofHours(2)));

        assertEquals(Duration.ofHours(2), next.maxAge());
        assertEquals(CacheConfig.DEFAULT_MAX_SIZE_BYTES, next.maxSizeBytes());
        assertEquals(next, service.current());
    }

    @Test
    void invalidPatchKeepsPreviousConfig() {
        CacheConfigService service = new CacheConfigService(CacheConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> service.patch(CacheConfigUpdate.maxSize(0)));
        assertThrows(IllegalArgumentException.class, () -> service.patch(CacheConfigUpdate.maxAge(Duration.ZERO)));

        assertEquals(CacheConfig.defaults(), service.current());
    }

    @Test
    void storageTypeParsingIsLenient() {
        assertEquals(StorageType.DURABLE_KV, StorageType.parse("durable-kv"));
        assertEquals(StorageType.BLOB_CACHE, StorageType.parse(" BLOB_CACHE "));
        assertEquals(StorageType.MEMORY, StorageType.parse("memory"));
        assertThrows(IllegalArgumentException.class, () -> StorageType.parse("tape"));
    }

    @Test
    void entryMetadataRejectsInconsistentTimestamps() {
        assertThrows(IllegalArgumentException.class, () -> new EntryMetadata("x", 1, 10, 5, "", "00"));
        assertThrows(IllegalArgumentException.class, () -> new EntryMetadata("x", -1, 0, 0, "", "00"));
        assertEquals(10, new EntryMetadata("x", 1, 10, 10, null, "00").withLastAccessed(3).lastAccessedAtMs());
    }
}
