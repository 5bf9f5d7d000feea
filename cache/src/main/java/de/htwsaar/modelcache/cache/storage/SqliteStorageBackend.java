package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.CacheEntry;
import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.error.BackendUnavailableException;
import de.htwsaar.modelcache.cache.error.StorageBackendException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dauerhaftes Key-Value-Backend auf SQLite, angesprochen über jOOQ.
 *
 * <p>Eine Tabelle {@code model_entries} mit Primärschlüssel {@code id} und einem Sekundärindex
 * auf {@code (last_accessed_at, created_at, id)}. Der Index liefert die LRU-Reihenfolge als
 * Range-Scan, ohne Payloads zu lesen. Zugriffszeitpunkte werden per {@code UPDATE} in place
 * geändert.</p>
 *
 * <p>Thread-Safety: eine JDBC-Verbindung, alle Zugriffe {@code synchronized}.</p>
 */
public final class SqliteStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(SqliteStorageBackend.class);

    private static final Table<Record> MODEL_ENTRIES = DSL.table(DSL.name("model_entries"));
    private static final Field<String> ID = DSL.field(DSL.name("id"), SQLDataType.VARCHAR);
    private static final Field<byte[]> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.BLOB);
    private static final Field<Long> SIZE = DSL.field(DSL.name("size"), SQLDataType.BIGINT);
    private static final Field<Long> CREATED_AT = DSL.field(DSL.name("created_at"), SQLDataType.BIGINT);
    private static final Field<Long> LAST_ACCESSED_AT = DSL.field(DSL.name("last_accessed_at"), SQLDataType.BIGINT);
    private static final Field<String> VERSION = DSL.field(DSL.name("version"), SQLDataType.VARCHAR);
    private static final Field<String> CHECKSUM = DSL.field(DSL.name("checksum"), SQLDataType.VARCHAR);

    private final Connection connection;
    private final DSLContext dsl;

    /**
     * Test-Konstruktor für eine bereits geöffnete Verbindung. Das Schema wird angelegt, falls nötig.
     *
     * @param connection offene SQLite-Verbindung (wird mit {@link #close()} geschlossen)
     */
    SqliteStorageBackend(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.dsl = DSL.using(connection, SQLDialect.SQLITE);
        initializeSchema();
    }

    /**
     * Öffnet (oder erzeugt) die Datenbankdatei.
     *
     * @param databaseFile Pfad der SQLite-Datei; fehlende Elternverzeichnisse werden angelegt
     * @return geöffnetes Backend
     * @throws BackendUnavailableException wenn Datei oder Treiber nicht nutzbar sind
     */
    public static SqliteStorageBackend open(Path databaseFile) {
        Objects.requireNonNull(databaseFile, "databaseFile must not be null");
        Connection connection = null;
        try {
            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
            SqliteStorageBackend backend = new SqliteStorageBackend(connection);
            log.info("Opened durable model cache at {}", databaseFile.toAbsolutePath());
            return backend;
        } catch (IOException | SQLException | DataAccessException e) {
            closeQuietly(connection);
            throw new BackendUnavailableException(StorageType.DURABLE_KV, databaseFile.toString(), e);
        }
    }

    /**
     * Legt Tabelle und LRU-Index an, falls sie noch nicht existieren.
     */
    private void initializeSchema() {
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS model_entries (
                        id TEXT PRIMARY KEY,
                        payload BLOB NOT NULL,
                        size INTEGER NOT NULL,
                        created_at INTEGER NOT NULL,
                        last_accessed_at INTEGER NOT NULL,
                        version TEXT NOT NULL,
                        checksum TEXT NOT NULL
                    )
                """);
        dsl.execute("""
                    CREATE INDEX IF NOT EXISTS idx_model_entries_last_accessed
                        ON model_entries (last_accessed_at, created_at, id)
                """);
    }

    @Override
    public StorageType type() {
        return StorageType.DURABLE_KV;
    }

    @Override
    public synchronized void put(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        EntryMetadata m = entry.metadata();
        run("put '" + m.id() + "'", () -> dsl.insertInto(MODEL_ENTRIES)
                .columns(ID, PAYLOAD, SIZE, CREATED_AT, LAST_ACCESSED_AT, VERSION, CHECKSUM)
                .values(m.id(), entry.payload(), m.size(), m.createdAtMs(), m.lastAccessedAtMs(), m.version(), m.checksum())
                .onConflict(ID)
                .doUpdate()
                .set(PAYLOAD, entry.payload())
                .set(SIZE, m.size())
                .set(CREATED_AT, m.createdAtMs())
                .set(LAST_ACCESSED_AT, m.lastAccessedAtMs())
                .set(VERSION, m.version())
                .set(CHECKSUM, m.checksum())
                .execute());
    }

    @Override
    public synchronized Optional<CacheEntry> get(String id) {
        if (id == null) return Optional.empty();
        return run("get '" + id + "'", () -> dsl.select(ID, PAYLOAD, SIZE, CREATED_AT, LAST_ACCESSED_AT, VERSION, CHECKSUM)
                .from(MODEL_ENTRIES)
                .where(ID.eq(id))
                .fetchOptional()
                .map(r -> new CacheEntry(toMetadata(r), r.get(PAYLOAD))));
    }

    @Override
    public synchronized Optional<EntryMetadata> getMetadata(String id) {
        if (id == null) return Optional.empty();
        return run("read metadata of '" + id + "'", () -> dsl.select(ID, SIZE, CREATED_AT, LAST_ACCESSED_AT, VERSION, CHECKSUM)
                .from(MODEL_ENTRIES)
                .where(ID.eq(id))
                .fetchOptional()
                .map(SqliteStorageBackend::toMetadata));
    }

    @Override
    public synchronized boolean delete(String id) {
        if (id == null) return false;
        return run("delete '" + id + "'", () -> dsl.deleteFrom(MODEL_ENTRIES).where(ID.eq(id)).execute() > 0);
    }

    @Override
    public synchronized List<EntryMetadata> listAll() {
        return run("list entries", () -> dsl.select(ID, SIZE, CREATED_AT, LAST_ACCESSED_AT, VERSION, CHECKSUM)
                .from(MODEL_ENTRIES)
                .orderBy(ID)
                .fetch(SqliteStorageBackend::toMetadata));
    }

    /**
     * Range-Scan über den Zugriffsindex statt Sortierung im Speicher.
     */
    @Override
    public synchronized List<EntryMetadata> listLeastRecentlyAccessed() {
        return run("list entries by last access", () -> dsl.select(ID, SIZE, CREATED_AT, LAST_ACCESSED_AT, VERSION, CHECKSUM)
                .from(MODEL_ENTRIES)
                .orderBy(LAST_ACCESSED_AT.asc(), CREATED_AT.asc(), ID.asc())
                .fetch(SqliteStorageBackend::toMetadata));
    }

    @Override
    public synchronized boolean touch(String id, long accessedAtMs) {
        if (id == null) return false;
        return run("touch '" + id + "'", () -> dsl.update(MODEL_ENTRIES)
                        .set(LAST_ACCESSED_AT, DSL.greatest(DSL.val(accessedAtMs), CREATED_AT))
                        .where(ID.eq(id))
                        .execute()
                > 0);
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Closing SQLite connection failed: {}", e.getMessage());
        }
    }

    private static EntryMetadata toMetadata(Record r) {
        return new EntryMetadata(
                r.get(ID),
                r.get(SIZE),
                r.get(CREATED_AT),
                r.get(LAST_ACCESSED_AT),
                r.get(VERSION),
                r.get(CHECKSUM));
    }

    private static <T> T run(String action, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new StorageBackendException("SQLite backend failed to " + action, e);
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Ignoring close failure after open error: {}", e.getMessage());
        }
    }
}
