package com.artinerary.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JSON shape shared by every endpoint: snowflake ids as strings, event times as ISO-8601 text.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer engageJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer idSerializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, idSerializer);
            builder.serializerByType(Long.TYPE, idSerializer);
            // startTime / createdAt are LocalDateTime; clients parse them as text
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        };
    }
}
