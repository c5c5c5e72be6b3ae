package com.pdm.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdm.common.util.JsonUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Uses the shared analysis mapper for HTTP bodies, so API payloads and
 * catalog files follow the same JSON conventions. Request bodies are
 * buffered whole before decoding and capped at {@code pdm.engine.max-request-size}.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    private final DataSize maxRequestSize;

    public JacksonConfig(@Value("${pdm.engine.max-request-size:2MB}") DataSize maxRequestSize) {
        this.maxRequestSize = maxRequestSize;
    }

    @Bean
    @Primary
    public ObjectMapper analysisObjectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = JsonUtil.getObjectMapper();
        Jackson2JsonDecoder decoder = new Jackson2JsonDecoder(mapper);
        decoder.setMaxInMemorySize((int) maxRequestSize.toBytes());

        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(decoder);
    }
}
