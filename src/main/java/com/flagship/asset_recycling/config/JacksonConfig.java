package com.flagship.asset_recycling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Jackson configuration shared by the REST layer and the event outbox.
 *
 * - ISO-8601 instants instead of epoch numbers
 * - Unit ids ({@link BigInteger}) written as strings so 256-bit ids survive
 *   JavaScript clients; they are still accepted as numbers or strings on input
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule unitIds = new SimpleModule("unit-ids");
        unitIds.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(unitIds);

        return mapper;
    }
}
