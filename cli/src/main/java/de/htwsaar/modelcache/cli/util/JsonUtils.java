package de.htwsaar.modelcache.cli.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Serialisiert ein Objekt eingerückt für die Ausgabe mit {@code --json}.
     *
     * @param value Record, Liste oder Map
     * @return pretty-printed JSON
     * @throws JsonProcessingException wenn das Objekt nicht serialisierbar ist
     */
    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
