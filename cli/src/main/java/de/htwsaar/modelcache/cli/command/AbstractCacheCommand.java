package de.htwsaar.modelcache.cli.command;

import de.htwsaar.modelcache.cache.ModelCache;
import de.htwsaar.modelcache.cache.error.ModelCacheException;
import de.htwsaar.modelcache.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine.ParentCommand;

/**
 * Gemeinsamer Ablauf aller Subcommands: Cache öffnen, Aktion ausführen, Cache schließen.
 *
 * <p>Exit-Codes:
 * - 0: OK
 * - 1: Storage-Fehler oder unerwartete Exception
 * - 2: ungültige Eingabe (Optionen, Datei, Größenbudget)
 * - 3: Eintrag nicht im Cache
 * - 4: Eintrag war korrupt und wurde entfernt
 */
abstract class AbstractCacheCommand implements Callable<Integer> {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int INVALID = 2;
    static final int NOT_FOUND = 3;
    static final int CORRUPT = 4;

    @ParentCommand
    private ModelCacheRootCommand root;

    @Override
    public final Integer call() {
        PrintWriter out = root.ctx().out();
        PrintWriter err = root.ctx().err();
        try (ModelCache cache = root.openCache()) {
            return execute(cache, out, err);
        } catch (IllegalArgumentException ex) {
            ConsoleUtils.error(err, "[CACHE] Invalid input: %s", ex.getMessage());
            return INVALID;
        } catch (ModelCacheException ex) {
            ConsoleUtils.error(err, "[CACHE] %s failed: %s", name(), ex.getMessage());
            return FAILED;
        }
    }

    /** Name für Fehlermeldungen. */
    abstract String name();

    /**
     * Eigentliche Aktion auf dem geöffneten Cache.
     *
     * @return Exit-Code
     */
    abstract int execute(ModelCache cache, PrintWriter out, PrintWriter err);
}
