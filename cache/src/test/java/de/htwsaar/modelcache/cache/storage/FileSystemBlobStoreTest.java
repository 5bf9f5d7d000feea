package de.htwsaar.modelcache.cache.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemBlobStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new FileSystemBlobStore(tempDir.resolve("root"));
    }

    @Test
    void putThenMatchReturnsBodyAndHeaders() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1, 2, 3}, Map.of("X-Test", "yes")));

        StoredBlob blob = store.match("/models/a").orElseThrow();
        assertArrayEquals(new byte[] {1, 2, 3}, blob.body());
        assertEquals("yes", blob.header("X-Test"));
        assertEquals(Map.of("X-Test", "yes"), store.matchHeaders("/models/a").orElseThrow());
    }

    @Test
    void bodyWithoutHeaderFileIsNotMatched() throws IOException {
        Path dir = Files.createDirectories(store.root().resolve("models"));
        Files.write(dir.resolve("orphan" + FileSystemBlobStore.BODY_SUFFIX), new byte[] {9});

        assertTrue(store.match("/models/orphan").isEmpty());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    void deleteRemovesBothFilesAndReportsExistence() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1}, Map.of()));

        assertTrue(store.delete("/models/a"));
        assertFalse(store.delete("/models/a"));
        assertEquals(List.of(), filesIn(store.root().resolve("models")));
    }

    @Test
    void rewritingAPathKeepsExactlyOneBodyFile() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1}, Map.of("v", "1")));
        store.put("/models/a", new StoredBlob(new byte[] {2, 2}, Map.of("v", "2")));

        StoredBlob blob = store.match("/models/a").orElseThrow();
        assertArrayEquals(new byte[] {2, 2}, blob.body());
        assertEquals("2", blob.header("v"));
        long bodies = filesIn(store.root().resolve("models")).stream()
                .filter(name -> name.endsWith(FileSystemBlobStore.BODY_SUFFIX))
                .count();
        assertEquals(1, bodies);
    }

    @Test
    void readersNeverSeeABodyFromAnotherWrite() throws Exception {
        byte[] small = new byte[1_000];
        byte[] large = new byte[1_500];
        Arrays.fill(large, (byte) 7);
        store.put("/models/a", new StoredBlob(small, Map.of("size", "1000")));

        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            Future<?> writes = writer.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    byte[] body = i % 2 == 0 ? large : small;
                    store.put("/models/a", new StoredBlob(body, Map.of("size", String.valueOf(body.length))));
                }
                return null;
            });
            while (!writes.isDone()) {
                store.match("/models/a").ifPresent(blob ->
                        assertEquals(blob.header("size"), String.valueOf(blob.body().length)));
            }
            writes.get(30, TimeUnit.SECONDS);
        } finally {
            writer.shutdownNow();
        }
        assertArrayEquals(small, store.match("/models/a").orElseThrow().body());
    }

    @Test
    void headerPointingOutsideItsDirectoryIsRejected() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1}, Map.of()));
        Files.writeString(store.root().resolve("models").resolve("a" + FileSystemBlobStore.HEADERS_SUFFIX),
                "{\"body\":\"../../secret.blob\",\"headers\":{}}");

        assertThrows(IOException.class, () -> store.match("/models/a"));
        assertThrows(IOException.class, () -> store.matchHeaders("/models/a"));
    }

    @Test
    void keysListsCompleteBlobsSorted() throws IOException {
        store.put("/models/b", new StoredBlob(new byte[] {1}, Map.of()));
        store.put("/models/a", new StoredBlob(new byte[] {2}, Map.of()));

        assertEquals(List.of("/models/a", "/models/b"), store.keys());
    }

    @Test
    void rejectsSegmentsThatCouldEscapeTheRoot() {
        StoredBlob blob = new StoredBlob(new byte[0], Map.of());
        assertThrows(IllegalArgumentException.class, () -> store.put("/models/../x", blob));
        assertThrows(IllegalArgumentException.class, () -> store.put("/models//x", blob));
        assertThrows(IllegalArgumentException.class, () -> store.put("  ", blob));
    }

    @Test
    void unreadableHeaderFileSurfacesAsIOException() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1}, Map.of()));
        Files.writeString(store.root().resolve("models").resolve("a" + FileSystemBlobStore.HEADERS_SUFFIX), "{not json");

        assertThrows(IOException.class, () -> store.match("/models/a"));
    }

    @Test
    void unreadableHeaderFileDoesNotBlockOverwriteOrDelete() throws IOException {
        store.put("/models/a", new StoredBlob(new byte[] {1}, Map.of()));
        Files.writeString(store.root().resolve("models").resolve("a" + FileSystemBlobStore.HEADERS_SUFFIX), "{not json");

        store.put("/models/a", new StoredBlob(new byte[] {4}, Map.of()));
        assertArrayEquals(new byte[] {4}, store.match("/models/a").orElseThrow().body());
        assertTrue(store.delete("/models/a"));
        assertTrue(store.match("/models/a").isEmpty());
    }

    private static List<String> filesIn(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(f -> f.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
