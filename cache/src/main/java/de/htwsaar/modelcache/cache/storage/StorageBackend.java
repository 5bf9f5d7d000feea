package de.htwsaar.modelcache.cache.storage;

import de.htwsaar.modelcache.cache.CacheEntry;
import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cache.eviction.LruEvictionPolicy;
import java.util.List;
import java.util.Optional;

/**
 * Einheitlicher Persistenzvertrag für alle Cache-Backends.
 *
 * <p>Semantik, die jede Implementierung einhalten muss:</p>
 * <ul>
 *   <li>{@link #get(String)} auf eine unbekannte ID liefert {@code Optional.empty()}, keinen Fehler.</li>
 *   <li>{@link #put(CacheEntry)} überschreibt stillschweigend; Payload und Metadaten werden komplett ersetzt.</li>
 *   <li>{@link #delete(String)} ist idempotent, eine unbekannte ID ergibt {@code false}.</li>
 * </ul>
 *
 * <p>Fehler des darunterliegenden Speichers werden als
 * {@link de.htwsaar.modelcache.cache.error.StorageBackendException} gemeldet.</p>
 */
public interface StorageBackend extends AutoCloseable {

    StorageType type();

    void put(CacheEntry entry);

    Optional<CacheEntry> get(String id);

    /**
     * Liest nur die Metadaten eines Eintrags.
     *
     * @param id Modell-ID
     * @return Metadaten oder leer
     */
    default Optional<EntryMetadata> getMetadata(String id) {
        return get(id).map(CacheEntry::metadata);
    }

    /**
     * @param id Modell-ID
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    boolean delete(String id);

    /**
     * Momentaufnahme aller Einträge (nur Metadaten).
     *
     * @return endliche, nicht live aktualisierte Liste
     */
    List<EntryMetadata> listAll();

    /**
     * Alle Einträge in Eviction-Reihenfolge: ältester Zugriff zuerst.
     *
     * @return sortierte Momentaufnahme
     */
    default List<EntryMetadata> listLeastRecentlyAccessed() {
        return listAll().stream().sorted(LruEvictionPolicy.ORDER).toList();
    }

    /**
     * Aktualisiert den Zugriffszeitpunkt. Backends ohne In-Place-Update schreiben den Eintrag neu.
     *
     * @param id           Modell-ID
     * @param accessedAtMs Zugriffszeitpunkt
     * @return {@code false} wenn der Eintrag nicht (mehr) existiert
     */
    default boolean touch(String id, long accessedAtMs) {
        Optional<CacheEntry> current = get(id);
        if (current.isEmpty()) return false;
        put(current.get().withLastAccessed(accessedAtMs));
        return true;
    }

    @Override
    void close();
}
