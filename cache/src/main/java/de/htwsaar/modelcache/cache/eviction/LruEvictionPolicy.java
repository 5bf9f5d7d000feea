package de.htwsaar.modelcache.cache.eviction;

import de.htwsaar.modelcache.cache.EntryMetadata;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Least-Recently-Used: ältester Zugriff fliegt zuerst raus.
 *
 * <p>Bei gleichem Zugriffszeitpunkt entscheidet der Erstellzeitpunkt, danach die ID. Die Auswahl
 * endet, sobald genug Bytes zusammenkommen.</p>
 */
public final class LruEvictionPolicy implements EvictionPolicy {

    public static final Comparator<EntryMetadata> ORDER = Comparator
            .comparingLong(EntryMetadata::lastAccessedAtMs)
            .thenComparingLong(EntryMetadata::createdAtMs)
            .thenComparing(EntryMetadata::id);

    @Override
    public List<String> selectVictims(List<EntryMetadata> candidates, long bytesToFree) {
        if (bytesToFree <= 0 || candidates == null || candidates.isEmpty()) return List.of();

        List<EntryMetadata> ordered = new ArrayList<>(candidates);
        ordered.sort(ORDER);

        List<String> victims = new ArrayList<>();
        long freed = 0;
        for (EntryMetadata m : ordered) {
            if (freed >= bytesToFree) break;
            victims.add(m.id());
            freed += m.size();
        }
        return victims;
    }
}
