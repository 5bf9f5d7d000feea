package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.integrity.IntegrityStatus;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Rechnet die Prüfsumme eines Eintrags nach. Korrupte Einträge entfernt der Cache dabei.
 */
@Command(name = "verify", description = "Verify the checksum of a cached artifact", mixinStandardHelpOptions = true)
public final class VerifyCommand extends AbstractCacheCommand {

    @Parameters(index = "0", paramLabel = "ID", description = "Modell-ID")
    private String id;

    @Override
    String name() {
        return "verify";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        IntegrityStatus status = cache.verify(id);
        return switch (status) {
            case INTACT -> {
                ConsoleUtils.info(out, "[CACHE] %s intact", id);
                yield OK;
            }
            case CORRUPT -> {
                ConsoleUtils.error(err, "[CACHE] %s corrupt, entry removed", id);
                yield CORRUPT;
            }
            case ABSENT -> {
                ConsoleUtils.error(err, "[CACHE] %s not in cache", id);
                yield NOT_FOUND;
            }
        };
    }
}
