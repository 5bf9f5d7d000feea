package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cli.util.ByteSizes;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Schreibt ein Artefakt aus dem Cache in eine Datei.
 */
@Command(name = "get", description = "Write a cached model artifact to a file", mixinStandardHelpOptions = true)
public final class GetCommand extends AbstractCacheCommand {

    @Parameters(index = "0", paramLabel = "ID", description = "Modell-ID")
    private String id;

    @Option(names = {"-o", "--out"}, required = true, paramLabel = "FILE", description = "Zieldatei")
    private Path target;

    @Override
    String name() {
        return "get";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        Optional<byte[]> payload = cache.retrieve(id);
        if (payload.isEmpty()) {
            ConsoleUtils.error(err, "[CACHE] MISS %s", id);
            return NOT_FOUND;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, payload.get());
        } catch (IOException ex) {
            ConsoleUtils.error(err, "[CACHE] Cannot write %s: %s", target, ex.getMessage());
            return FAILED;
        }
        ConsoleUtils.info(out, "[CACHE] HIT %s -> %s (%s)", id, target, ByteSizes.format(payload.get().length));
        return OK;
    }
}
