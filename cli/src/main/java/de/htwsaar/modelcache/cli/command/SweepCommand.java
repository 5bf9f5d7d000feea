package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.expiry.SweepResult;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

@Command(name = "sweep", description = "Remove expired entries now", mixinStandardHelpOptions = true)
public final class SweepCommand extends AbstractCacheCommand {

    @Override
    String name() {
        return "sweep";
    }

    @Override
    int execute(ModelCache cache, PrintWriter out, PrintWriter err) {
        SweepResult result = cache.sweepExpired();
        ConsoleUtils.info(out, "[CACHE] Sweep scanned=%d expired=%d failed=%d",
                result.scanned(), result.expired(), result.failed());
        return result.failed() > 0 ? FAILED : OK;
    }
}
