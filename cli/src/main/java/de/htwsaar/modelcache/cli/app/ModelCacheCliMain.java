package de.htwsaar.modelcache.cli.app;

import de.htwsaar.modelcache.cli.command.ModelCacheRootCommand;
import de.htwsaar.modelcache.cli.di.CliContext;
import de.htwsaar.modelcache.cli.di.ContextFactory;
import de.htwsaar.modelcache.cli.shell.ModelCacheInteractiveShell;
import java.io.PrintWriter;
import java.time.Clock;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Model-Cache CLI.
 *
 * <p>Mit Argumenten wird genau ein Befehl ausgeführt und der Prozess mit dessen Exit-Code beendet,
 * ohne Argumente startet die interaktive Shell.
 */
public final class ModelCacheCliMain {

    private ModelCacheCliMain() {}

    /**
     * @param args Kommandozeilenargumente (kann leer sein)
     * @throws Exception bei Terminal-Initialisierung oder unerwarteten Laufzeitfehlern
     */
    public static void main(String[] args) throws Exception {
        Terminal terminal = TerminalBuilder.builder().system(true).build();
        PrintWriter out = terminal.writer();
        PrintWriter err = terminal.writer();

        CliContext ctx = new CliContext(terminal, out, err, Clock.systemUTC());
        CommandLine cmd = new CommandLine(ModelCacheRootCommand.class, new ContextFactory(ctx));

        if (args != null && args.length > 0) {
            int rc = cmd.execute(args);
            terminal.close();
            System.exit(rc);
        }

        new ModelCacheInteractiveShell(cmd, ctx).run();
        terminal.close();
    }
}
