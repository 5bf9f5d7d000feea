package de.htwsaar.modelcache.cli.di;

import java.io.PrintWriter;
import java.time.Clock;
import java.util.Objects;
import org.jline.terminal.Terminal;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Aufgaben:
 * - Bündelt Terminal und Ausgabekanäle (stdout/stderr).
 * - Stellt die Zeitquelle bereit, mit der lokale Caches geöffnet werden.
 * - Ermöglicht testbare Commands durch Constructor Injection statt statischer Globals.
 *
 * <p>Konvention:
 * - Hier gehören nur generische Abhängigkeiten hinein (I/O, Zeit),
 *   keine fachlichen Services.
 */
public final class CliContext {
    private final Terminal terminal;
    private final PrintWriter out;
    private final PrintWriter err;
    private final Clock clock;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param terminal JLine-Terminal für interaktive Features (Prompt, Clear, History)
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param clock Zeitquelle für Erstellungs- und Zugriffszeitpunkte
     */
    public CliContext(Terminal terminal, PrintWriter out, PrintWriter err, Clock clock) {
        this.terminal = Objects.requireNonNull(terminal);
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.clock = Objects.requireNonNull(clock);
    }

    public Terminal terminal() {
        return terminal;
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public Clock clock() {
        return clock;
    }
}
