package de.htwsaar.modelcache.cli.util;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Formatierte Info- und Fehlermeldungen auf der Konsole, jeweils mit Zeilenumbruch und Flush.
 */
public final class ConsoleUtils {
    private ConsoleUtils() {}

    public static void info(PrintWriter out, String fmt, Object... args) {
        Objects.requireNonNull(out, "out");
        out.printf(fmt + "%n", args);
        out.flush();
    }

    public static void error(PrintWriter err, String fmt, Object... args) {
        Objects.requireNonNull(err, "err");
        err.printf(fmt + "%n", args);
        err.flush();
    }
}
