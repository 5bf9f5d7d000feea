package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.common.serialization.JacksonCodec;
import de.htwsaar.modelcache.common.serialization.JsonCodecException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * {@link BlobStore}-Adapter auf das lokale Dateisystem.
 *
 * <p>Pro Pfad eine Header-Datei {@code <name>.headers.json} und eine Body-Datei
 * {@code <name>.<generation>.blob}. Jedes {@code put} schreibt einen neuen Body, danach den Header,
 * der auf genau diesen Body zeigt, und löscht erst dann den alten Body. Ein Leser sieht daher immer
 * ein zusammengehöriges Paar; verschwindet der Body zwischen Header- und Body-Lesen, wird neu
 * gelesen. Ein Blob ohne Header gilt als nicht vorhanden. Dateien werden über Temp-Datei plus
 * atomaren Move ersetzt.</p>
 *
 * <p>Pfadsegmente dürfen keine Punkte und keine Trennzeichen enthalten; der aufrufende
 * {@link BlobCacheBackend} kodiert IDs entsprechend.</p>
 */
public final class FileSystemBlobStore implements BlobStore {

    static final String BODY_SUFFIX = ".blob";
    static final String HEADERS_SUFFIX = ".headers.json";
    static final int MAX_READ_ATTEMPTS = 5;

    private final Path root;

    /**
     * @param root Wurzelverzeichnis; wird angelegt, falls es fehlt
     * @throws IOException wenn das Verzeichnis nicht angelegt werden kann
     */
    public FileSystemBlobStore(Path root) throws IOException {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        Files.createDirectories(this.root);
    }

    public Path root() {
        return root;
    }

    @Override
    public void put(String path, StoredBlob blob) throws IOException {
        Objects.requireNonNull(blob, "blob must not be null");
        Path base = resolve(path);
        Files.createDirectories(base.getParent());
        Optional<HeaderFile> previous = readHeaderFileIgnoringGarbage(base);

        String bodyName = base.getFileName() + "." + UUID.randomUUID().toString().replace("-", "") + BODY_SUFFIX;
        writeAtomically(base.resolveSibling(bodyName), blob.body());
        writeAtomically(headersFile(base), JacksonCodec.toJsonBytes(new HeaderFile(bodyName, blob.headers())));

        if (previous.isPresent() && !bodyName.equals(previous.get().body())) {
            deleteBody(base, previous.get());
        }
    }

    @Override
    public Optional<StoredBlob> match(String path) throws IOException {
        Path base = resolve(path);
        for (int attempt = 0; attempt < MAX_READ_ATTEMPTS; attempt++) {
            Optional<HeaderFile> header = readHeaderFile(base);
            if (header.isEmpty()) return Optional.empty();
            try {
                byte[] body = Files.readAllBytes(bodyFile(base, header.get()));
                return Optional.of(new StoredBlob(body, headersOf(header.get())));
            } catch (NoSuchFileException e) {
                // Body wurde ersetzt oder gelöscht, Header neu lesen
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Map<String, String>> matchHeaders(String path) throws IOException {
        return readHeaderFile(resolve(path)).map(FileSystemBlobStore::headersOf);
    }

    @Override
    public boolean delete(String path) throws IOException {
        Path base = resolve(path);
        Optional<HeaderFile> header = readHeaderFileIgnoringGarbage(base);
        boolean existed = Files.deleteIfExists(headersFile(base));
        if (header.isPresent()) {
            deleteBody(base, header.get());
        }
        return existed;
    }

    @Override
    public List<String> keys() throws IOException {
        List<String> keys = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .map(p -> p.toString().replace('\\', '/'))
                    .filter(p -> p.endsWith(HEADERS_SUFFIX))
                    .map(p -> "/" + p.substring(0, p.length() - HEADERS_SUFFIX.length()))
                    .sorted()
                    .forEach(keys::add);
        }
        return keys;
    }

    @Override
    public void close() {
        // keine offenen Handles
    }

    private Optional<HeaderFile> readHeaderFile(Path base) throws IOException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(headersFile(base));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        HeaderFile file;
        try {
            file = JacksonCodec.fromJson(raw, HeaderFile.class);
        } catch (JsonCodecException e) {
            throw new IOException("Unreadable headers at " + headersFile(base), e);
        }
        if (!isOwnBodyName(base, file.body())) {
            throw new IOException("Header at " + headersFile(base) + " points to foreign body '" + file.body() + "'");
        }
        return Optional.of(file);
    }

    /** Für Aufräumarbeiten: eine kaputte Header-Datei verhindert weder Überschreiben noch Löschen. */
    private Optional<HeaderFile> readHeaderFileIgnoringGarbage(Path base) {
        try {
            return readHeaderFile(base);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private static boolean isOwnBodyName(Path base, String bodyName) {
        if (bodyName == null) return false;
        String prefix = base.getFileName() + ".";
        return bodyName.startsWith(prefix)
                && bodyName.endsWith(BODY_SUFFIX)
                && bodyName.length() > prefix.length() + BODY_SUFFIX.length()
                && bodyName.indexOf('/') < 0
                && bodyName.indexOf('\\') < 0;
    }

    private static Map<String, String> headersOf(HeaderFile file) {
        return file.headers() == null ? Map.of() : file.headers();
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        String clean = path.trim();
        while (clean.startsWith("/")) clean = clean.substring(1);
        if (clean.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one segment: " + path);
        }
        Path resolved = root;
        for (String segment : clean.split("/")) {
            if (segment.isEmpty() || segment.contains(".") || segment.contains("\\")) {
                throw new IllegalArgumentException("Illegal path segment '" + segment + "' in " + path);
            }
            resolved = resolved.resolve(segment);
        }
        return resolved;
    }

    private static Path bodyFile(Path base, HeaderFile header) {
        return base.resolveSibling(header.body());
    }

    private static void deleteBody(Path base, HeaderFile header) throws IOException {
        Files.deleteIfExists(bodyFile(base, header));
    }

    private static Path headersFile(Path base) {
        return base.resolveSibling(base.getFileName() + HEADERS_SUFFIX);
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Serialisierte Form der Header-Datei.
     *
     * @param body    Dateiname des zugehörigen Bodys im selben Verzeichnis
     * @param headers Header-Map
     */
    record HeaderFile(String body, Map<String, String> headers) {}
}
