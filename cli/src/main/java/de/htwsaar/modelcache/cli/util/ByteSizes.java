package de.htwsaar.modelcache.cli.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Größenangaben wie {@code 500MB}, {@code 2GiB} oder {@code 1048576}.
 *
 * <p>Einheiten sind binär ({@code KB} = 1024 Bytes), die Schreibweise mit {@code i} ist gleichwertig.
 */
public final class ByteSizes {

    private static final Pattern SIZE = Pattern.compile("(\\d+)\\s*(?:([KMGT])I?)?B?");

    private ByteSizes() {}

    /**
     * @param raw Größenangabe, Groß-/Kleinschreibung egal
     * @return Anzahl Bytes
     * @throws IllegalArgumentException bei unlesbarer Angabe oder Überlauf
     */
    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("size must not be blank");
        }
        Matcher m = SIZE.matcher(raw.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Unreadable size: " + raw);
        }
        long value = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "B" : m.group(2);
        int shift = switch (unit.charAt(0)) {
            case 'K' -> 10;
            case 'M' -> 20;
            case 'G' -> 30;
            case 'T' -> 40;
            default -> 0;
        };
        if (shift > 0 && value > (Long.MAX_VALUE >> shift)) {
            throw new IllegalArgumentException("Size too large: " + raw);
        }
        return value << shift;
    }

    /**
     * Menschenlesbare Form, z. B. {@code 1.5 MiB}.
     *
     * @param bytes Anzahl Bytes
     * @return formatierte Größe
     */
    public static String format(long bytes) {
        if (bytes < 1024) return bytes + " B";
        String[] units = {"KiB", "MiB", "GiB", "TiB"};
        double value = bytes;
        int i = -1;
        while (value >= 1024 && i < units.length - 1) {
            value /= 1024;
            i++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[i]);
    }
}
