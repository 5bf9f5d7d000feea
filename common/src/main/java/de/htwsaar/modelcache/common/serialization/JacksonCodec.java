package de.htwsaar.modelcache.common.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/**
 * Zentraler JSON-Codec für Metadaten-Header und persistierte Statistiken.
 *
 * <p>Unbekannte Felder werden beim Lesen ignoriert, damit ältere Dateien mit neueren
 * Datensätzen lesbar bleiben.</p>
 */
public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JacksonCodec() {
        // Utility
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to serialize " + typeName(obj) + " to JSON", e);
        }
    }

    public static byte[] toJsonBytes(Object obj) {
        try {
            return MAPPER.writeValueAsBytes(obj);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to serialize " + typeName(obj) + " to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to deserialize JSON to [" + clazz.getSimpleName() + "]", e);
        }
    }

    public static <T> T fromJson(byte[] json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (IOException e) {
            throw new JsonCodecException("Failed to deserialize JSON to [" + clazz.getSimpleName() + "]", e);
        }
    }

    private static String typeName(Object obj) {
        return obj == null ? "null" : obj.getClass().getSimpleName();
    }
}
