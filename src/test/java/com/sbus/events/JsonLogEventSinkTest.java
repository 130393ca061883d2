package com.sbus.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JsonLogEventSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testEventIsWrittenAsOneJsonObject() throws Exception {
        EntityEvent event = EntityEvent.builder(EntityEvent.EventType.SETTLEMENT_TIMED_OUT)
                .timestamp(Instant.parse("2026-01-01T00:00:20Z"))
                .connectionId("connection-1")
                .entity("orders-1", "orders")
                .detail("deliveryId", 7L)
                .build();

        String json = new JsonLogEventSink().toJson(event);

        assertThat(json).doesNotContain("\n");
        JsonNode node = mapper.readTree(json);
        assertThat(node.get("type").asText()).isEqualTo("SETTLEMENT_TIMED_OUT");
        assertThat(node.get("timestamp").asText()).isEqualTo("2026-01-01T00:00:20Z");
        assertThat(node.get("entity").asText()).isEqualTo("orders-1");
        assertThat(node.get("details").get("deliveryId").asLong()).isEqualTo(7L);
    }

    @Test
    void testComplexDetailsAreStoredAsText() throws Exception {
        UUID token = UUID.randomUUID();
        EntityEvent event = EntityEvent.builder(EntityEvent.EventType.LOCK_RENEWED)
                .detail("lockToken", token)
                .detail("renewed", true)
                .build();

        JsonNode node = mapper.readTree(new JsonLogEventSink().toJson(event));

        assertThat(node.get("details").get("lockToken").asText()).isEqualTo(token.toString());
        assertThat(node.get("details").get("renewed").asBoolean()).isTrue();
    }

    @Test
    void testRecordDoesNotThrow() {
        JsonLogEventSink sink = new JsonLogEventSink();

        assertThatCode(() -> sink.record(EntityEvent.builder(EntityEvent.EventType.LINK_DETACHED).build()))
                .doesNotThrowAnyException();
    }
}
