package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

/**
 * Leert den Cache und setzt die Statistik zurück.
 */
@Command(name = "clear", description = "Remove all entries and reset statistics", mixinStandardHelpOptions = true)
public final class ClearCommand extends AbstractCacheCommand {

    @Override
    String name() {
        return "clear";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        int removed = cache.clear();
        ConsoleUtils.info(out, "[CACHE] Cleared %d entries", removed);
        return OK;
    }
}
