package de.htwsaar.modelcache.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256-Hilfsfunktionen für Prüfsummen von Artefakt-Payloads.
 *
 * <p>Alle Digests werden als klein geschriebener Hex-String (64 Zeichen) geliefert.</p>
 */
public final class Sha256Util {

    /** Länge eines SHA-256-Hex-Strings. */
    public static final int HEX_LENGTH = 64;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Sha256Util() {}

    /**
     * Berechnet den SHA-256-Digest der übergebenen Bytes.
     *
     * @param data Eingabe (darf nicht {@code null} sein)
     * @return Digest als Hex-String
     */
    public static String sha256Hex(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        return toHex(newDigest().digest(data));
    }

    /**
     * Vergleicht einen erwarteten Digest mit dem tatsächlichen Digest der Daten.
     * Groß-/Kleinschreibung des erwarteten Werts spielt keine Rolle.
     *
     * @param expectedHex erwarteter Digest
     * @param data        zu prüfende Bytes
     * @return {@code true} bei Übereinstimmung
     */
    public static boolean matches(String expectedHex, byte[] data) {
        if (expectedHex == null || data == null) return false;
        return MessageDigest.isEqual(
                expectedHex.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII),
                sha256Hex(data).getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Prüft, ob ein String formal ein SHA-256-Hex-Digest ist.
     *
     * @param value Kandidat
     * @return {@code true} wenn 64 Hex-Zeichen
     */
    public static boolean isSha256Hex(String value) {
        if (value == null || value.length() != HEX_LENGTH) return false;
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available in this JVM", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
