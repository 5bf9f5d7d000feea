package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.error.CapacityExceededException;
import de.htwsaar.modelcache.cli.util.ByteSizes;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Legt eine Datei als Modell-Artefakt ab.
 */
@Command(
        name = "put",
        description = "Store a model artifact from a file",
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  modelcache put bert-base -f ./bert.onnx --version 1.2",
            "  modelcache --storage blob-cache put org/sentiment -f model.bin"
        })
public final class PutCommand extends AbstractCacheCommand {

    // -V/--version der Standard-Optionen kollidiert mit dem Versionslabel
    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
    private boolean helpRequested;

    @Parameters(index = "0", paramLabel = "ID", description = "Modell-ID")
    private String id;

    @Option(names = {"-f", "--file"}, required = true, paramLabel = "FILE", description = "Quelldatei")
    private Path file;

    @Option(names = {"-v", "--version"}, defaultValue = "", paramLabel = "LABEL", description = "Versionslabel")
    private String version;

    @Override
    String name() {
        return "put";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        byte[] payload;
        try {
            payload = Files.readAllBytes(file);
        } catch (IOException ex) {
            ConsoleUtils.error(err, "[CACHE] Cannot read %s: %s", file, ex.getMessage());
            return INVALID;
        }

        try {
            cache.store(id, payload, version);
        } catch (CapacityExceededException ex) {
            ConsoleUtils.error(err, "[CACHE] %s (%s) exceeds the cache budget of %s",
                    id, ByteSizes.format(ex.getPayloadSize()), ByteSizes.format(ex.getMaxSize()));
            return INVALID;
        }
        ConsoleUtils.info(out, "[CACHE] Stored %s (%s)", id, ByteSizes.format(payload.length));
        return OK;
    }
}
