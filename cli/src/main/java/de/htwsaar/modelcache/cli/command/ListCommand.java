package de.htwsaar.modelcache.cli.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.htwsaar.modelcache.cache.EntryMetadata;
import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cli.util.ByteSizes;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import de.htwsaar.modelcache.cli.util.JsonUtils;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Listet alle nicht abgelaufenen Einträge, am längsten unbenutzte zuerst.
 */
@Command(name = "ls", description = "List cached model artifacts", mixinStandardHelpOptions = true)
public final class ListCommand extends AbstractCacheCommand {

    @Option(names = "--json", defaultValue = "false", description = "Metadaten als JSON ausgeben")
    private boolean printJson;

    @Override
    String name() {
        return "ls";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        List<EntryMetadata> entries = cache.list();

        if (printJson) {
            try {
                ConsoleUtils.info(out, "%s", JsonUtils.toPrettyJson(entries));
                return OK;
            } catch (JsonProcessingException ex) {
                ConsoleUtils.error(err, "[CACHE] Cannot render JSON: %s", ex.getOriginalMessage());
                return FAILED;
            }
        }

        if (entries.isEmpty()) {
            ConsoleUtils.info(out, "[CACHE] (empty)");
            return OK;
        }
        for (EntryMetadata e : entries) {
            out.printf("%-40s %10s  %-12s %s%n",
                    e.id(),
                    ByteSizes.format(e.size()),
                    e.version().isEmpty() ? "-" : e.version(),
                    Instant.ofEpochMilli(e.lastAccessedAtMs()));
        }
        out.flush();
        return OK;
    }
}
