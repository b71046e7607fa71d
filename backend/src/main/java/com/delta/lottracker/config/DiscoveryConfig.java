package com.delta.lottracker.config;

import com.delta.lottracker.discovery.augment.AuthSession;
import com.delta.lottracker.discovery.augment.StaticAuthSession;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DiscoveryConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(DiscoveryProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetchConcurrency());
    }

    @Bean(name = "augmentExecutor", destroyMethod = "shutdown")
    public ExecutorService augmentExecutor(DiscoveryProperties properties) {
        return Executors.newFixedThreadPool(properties.getAugment().getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(DiscoveryProperties properties) {
        int size = Math.max(4, properties.getFetchConcurrency() + properties.getAugment().getConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "discoveryRunExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuthSession authSession(DiscoveryProperties properties) {
        return new StaticAuthSession(properties.getAuth().getCookie(), properties.getAuth().getBearerToken());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
