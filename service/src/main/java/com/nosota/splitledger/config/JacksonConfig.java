package com.nosota.splitledger.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Money crosses every JSON boundary as an exact decimal string, never as a binary float.
 */
@Configuration
public class JacksonConfig {

    /**
     * Picked up by Spring Boot's Jackson auto-configuration like any other {@link Module} bean.
     */
    @Bean
    public Module moneyModule() {
        SimpleModule module = new SimpleModule("split-ledger-money");
        module.addSerializer(BigDecimal.class, new PlainDecimalSerializer());
        return module;
    }

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer decimalFloatsCustomizer() {
        return builder -> builder.featuresToEnable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    static class PlainDecimalSerializer extends StdSerializer<BigDecimal> {

        PlainDecimalSerializer() {
            super(BigDecimal.class);
        }

        @Override
        public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toPlainString());
        }
    }
}
