package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.StorageType;
import de.htwsaar.modelcache.cli.di.CliContext;
import de.htwsaar.modelcache.cli.service.CacheOptions;
import de.htwsaar.modelcache.cli.service.LocalCacheService;
import de.htwsaar.modelcache.cli.util.ByteSizes;
import de.htwsaar.modelcache.cli.util.Durations;
import java.nio.file.Path;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Aufgaben:
 * - Definiert Name, Beschreibung und globale Help-Optionen der CLI.
 * - Hält die Cache-Optionen ({@code --dir}, {@code --storage}, ...), die alle Subcommands teilen.
 * - Zeigt ohne Subcommand die Usage.
 */
@Command(
        name = "modelcache",
        description = "Local model artifact cache",
        mixinStandardHelpOptions = true,
        subcommands = {
            PutCommand.class,
            GetCommand.class,
            RemoveCommand.class,
            ListCommand.class,
            StatsCommand.class,
            ClearCommand.class,
            SweepCommand.class,
            VerifyCommand.class,
            HelpCommand.class
        })
public final class ModelCacheRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    @Option(
            names = {"-d", "--dir"},
            defaultValue = "./model-cache",
            paramLabel = "DIR",
            description = "Cache-Verzeichnis (Standard: ${DEFAULT-VALUE})")
    private Path dir;

    @Option(
            names = {"-s", "--storage"},
            defaultValue = "durable-kv",
            paramLabel = "memory|durable-kv|blob-cache",
            description = "Storage-Backend (Standard: ${DEFAULT-VALUE})")
    private String storage;

    @Option(
            names = "--max-size",
            defaultValue = "500MB",
            paramLabel = "SIZE",
            description = "Größenbudget, z.B. 500MB oder 2GiB (Standard: ${DEFAULT-VALUE})")
    private String maxSize;

    @Option(
            names = "--max-age",
            defaultValue = "7d",
            paramLabel = "DURATION",
            description = "Höchstalter, z.B. 12h, 7d oder PT30M (Standard: ${DEFAULT-VALUE})")
    private String maxAge;

    @Option(names = "--verify-on-read", description = "Prüfsumme bei jedem Lesen nachrechnen")
    private boolean verifyOnRead;

    /**
     * Konstruktor für Constructor Injection via {@code ContextFactory}.
     *
     * @param ctx CLI-Kontext (Terminal, Output, Clock)
     */
    public ModelCacheRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `modelcache help <command>` oder starte ohne Args für die interaktive Shell.");
        ctx.out().flush();
    }

    /**
     * Löst die Root-Optionen auf.
     *
     * @return validierte Optionen
     * @throws IllegalArgumentException bei unlesbaren Werten
     */
    CacheOptions cacheOptions() {
        return new CacheOptions(
                dir, StorageType.parse(storage), ByteSizes.parse(maxSize), Durations.parse(maxAge), verifyOnRead);
    }

    /**
     * Öffnet den Cache mit den aktuellen Optionen. Der Aufrufer schließt ihn.
     *
     * @return geöffneter Cache
     */
    ModelCache openCache() {
        return new LocalCacheService(ctx.clock()).open(cacheOptions());
    }

    CliContext ctx() {
        return ctx;
    }
}
