package com.artinerary.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButCountsRemainNumbers() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new Payload(2004874454540382209L, 3L, 9007199254740993L, 12L, 42L));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("eventId").isTextual()).isTrue();
            assertThat(node.get("decidedBy").isTextual()).isTrue();
            assertThat(node.get("decidedBy").asText()).isEqualTo("9007199254740993");
            assertThat(node.get("unreadCount").isNumber()).isTrue();
            assertThat(node.get("total").isNumber()).isTrue();
        });
    }

    @Test
    void eventTimesSerializedAsIsoText() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(
                    new Schedule(LocalDateTime.of(2026, 5, 1, 18, 30))));

            assertThat(node.get("startTime").isTextual()).isTrue();
            assertThat(node.get("startTime").asText()).isEqualTo("2026-05-01T18:30:00");
        });
    }

    record Schedule(LocalDateTime startTime) {
    }

    record Payload(long id, long eventId, long decidedBy, long unreadCount, long total) {
    }
}
