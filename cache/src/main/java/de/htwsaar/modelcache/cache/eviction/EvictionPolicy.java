package de.htwsaar.modelcache.cache.eviction;

import de.htwsaar.modelcache.cache.EntryMetadata;
import java.util.List;

/**
 * Strategie zur Auswahl von Einträgen, die für neuen Platz weichen müssen.
 *
 * <p>Implementierungen sind rein: sie wählen nur aus und löschen nichts.</p>
 */
public interface EvictionPolicy {

    /**
     * @param candidates  Metadaten aller evictierbaren Einträge (beliebige Reihenfolge)
     * @param bytesToFree Anzahl Bytes, die mindestens frei werden sollen
     * @return IDs in Löschreihenfolge; leer wenn {@code bytesToFree <= 0}
     */
    List<String> selectVictims(List<EntryMetadata> candidates, long bytesToFree);
}
