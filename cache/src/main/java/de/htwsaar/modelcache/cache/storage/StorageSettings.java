package de.htwsaar.modelcache.cache.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Ablageorte der persistenten Backends.
 *
 * @param sqliteFile Datenbankdatei des Key-Value-Backends
 * @param blobRoot   Wurzelverzeichnis des Blob-Backends
 */
public record StorageSettings(Path sqliteFile, Path blobRoot) {

    public static final String SQLITE_FILE_NAME = "model-cache.db";
    public static final String BLOB_DIR_NAME = "blobs";

    public StorageSettings {
        Objects.requireNonNull(sqliteFile, "sqliteFile must not be null");
        Objects.requireNonNull(blobRoot, "blobRoot must not be null");
    }

    /**
     * Standard-Layout unterhalb eines Datenverzeichnisses.
     *
     * @param dataDir Datenverzeichnis
     * @return Einstellungen mit {@code model-cache.db} und {@code blobs/}
     */
    public static StorageSettings under(Path dataDir) {
        Objects.requireNonNull(dataDir, "dataDir must not be null");
        return new StorageSettings(dataDir.resolve(SQLITE_FILE_NAME), dataDir.resolve(BLOB_DIR_NAME));
    }
}
