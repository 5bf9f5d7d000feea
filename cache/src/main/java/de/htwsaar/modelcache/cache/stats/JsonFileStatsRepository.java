package de.htwsaar.modelcache.cache.stats;

import de.htwsaar.modelcache.common.serialization.JacksonCodec;
import de.htwsaar.modelcache.common.serialization.JsonCodecException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Speichert die Statistik als JSON-Datei (z. B. {@code stats.json} im Datenverzeichnis).
 *
 * <p>Schreiben erfolgt über eine Temp-Datei im selben Verzeichnis und anschließendes Umbenennen,
 * damit nach einem Absturz nie eine halb geschriebene Datei liegen bleibt.</p>
 */
public final class JsonFileStatsRepository implements StatsRepository {

    public static final String DEFAULT_FILE_NAME = "stats.json";

    private final Path file;

    public JsonFileStatsRepository(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<PersistedStats> load() throws IOException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        try {
            return Optional.of(JacksonCodec.fromJson(raw, PersistedStats.class));
        } catch (JsonCodecException e) {
            throw new IOException("Unreadable stats file " + file, e);
        }
    }

    @Override
    public void save(PersistedStats stats) throws IOException {
        Objects.requireNonNull(stats, "stats must not be null");
        Path dir = file.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, JacksonCodec.toJsonBytes(stats));
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
