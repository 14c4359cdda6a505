package com.spreadtracker.history.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    @Value("${services.market-data.base-url:http://localhost:8081}")
    private String marketDataUrl;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return builder.baseUrl(marketDataUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Day and hour buckets are UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
