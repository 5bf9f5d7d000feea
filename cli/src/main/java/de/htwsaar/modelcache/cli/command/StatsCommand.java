package de.htwsaar.modelcache.cli.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.htwsaar.modelcache.cache.CacheStats;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cli.util.ByteSizes;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import de.htwsaar.modelcache.cli.util.JsonUtils;
import java.io.PrintWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Zeigt die persistierte Cache-Statistik.
 */
@Command(name = "stats", description = "Show cache statistics", mixinStandardHelpOptions = true)
public final class StatsCommand extends AbstractCacheCommand {

    @Option(names = "--json", defaultValue = "false", description = "Statistik als JSON ausgeben")
    private boolean printJson;

    @Override
    String name() {
        return "stats";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        CacheStats stats = cache.getStats();

        if (printJson) {
            try {
                ConsoleUtils.info(out, "%s", JsonUtils.toPrettyJson(stats));
                return OK;
            } catch (JsonProcessingException ex) {
                ConsoleUtils.error(err, "[CACHE] Cannot render JSON: %s", ex.getOriginalMessage());
                return FAILED;
            }
        }

        out.println("[CACHE] Model cache stats");
        out.printf("  backend       : %s%s%n", cache.activeStorageType(), cache.isFallbackActive() ? " (fallback)" : "");
        out.printf("  totalSize     : %s%n", ByteSizes.format(stats.totalSize()));
        out.printf("  entryCount    : %d%n", stats.entryCount());
        out.printf("  hitCount      : %d%n", stats.hitCount());
        out.printf("  missCount     : %d%n", stats.missCount());
        out.printf("  hitRate       : %.4f%n", stats.hitRate());
        out.printf("  missRate      : %.4f%n", stats.missRate());
        out.printf("  evictionCount : %d%n", stats.evictionCount());
        out.flush();
        return OK;
    }
}
