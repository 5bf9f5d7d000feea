package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Entfernt einen Eintrag; ein fehlender Eintrag ist kein Fehler.
 */
@Command(name = "rm", description = "Remove a model artifact", mixinStandardHelpOptions = true)
public final class RemoveCommand extends AbstractCacheCommand {

    @Parameters(index = "0", paramLabel = "ID", description = "Modell-ID")
    private String id;

    @Override
    String name() {
        return "rm";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        if (cache.remove(id)) {
            ConsoleUtils.info(out, "[CACHE] Removed %s", id);
        } else {
            ConsoleUtils.info(out, "[CACHE] %s not in cache", id);
        }
        return OK;
    }
}
