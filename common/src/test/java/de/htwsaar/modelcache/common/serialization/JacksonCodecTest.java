package de.htwsaar.modelcache.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class JacksonCodecTest {

    record Sample(String id, long size, Duration maxAge) {}

    @Test
    void toJson_writesRecordComponents() {
        String json = JacksonCodec.toJson(new Sample("bert-base", 1024, Duration.ofMinutes(5)));

        assertTrue(json.contains("\"id\":\"bert-base\""));
        assertTrue(json.contains("\"size\":1024"));
    }

    @Test
    void fromJson_readsRecordAndIgnoresUnknownFields() {
        String json = "{\"id\":\"svd\",\"size\":7,\"maxAge\":60.0,\"legacy\":true}";

        Sample sample = JacksonCodec.fromJson(json, Sample.class);

        assertEquals("svd", sample.id());
        assertEquals(7, sample.size());
        assertEquals(Duration.ofSeconds(60), sample.maxAge());
    }

    @Test
    void fromJsonBytes_acceptsOutputOfToJsonBytes() {
        byte[] bytes = JacksonCodec.toJsonBytes(new Sample("x", 1, Duration.ZERO));

        assertEquals("x", JacksonCodec.fromJson(bytes, Sample.class).id());
    }

    @Test
    void fromJson_invalidJson_throwsCodecException() {
        assertThrows(JsonCodecException.class, () -> JacksonCodec.fromJson("{id: kaputt}", Sample.class));
        assertThrows(
                JsonCodecException.class,
                () -> JacksonCodec.fromJson("[".getBytes(StandardCharsets.UTF_8), Sample.class));
    }
}
