package com.siteready.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AuditConfig {

    @Bean(name = "crawlExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlExecutor(SiteReadyProperties properties) {
        return Executors.newFixedThreadPool(properties.getCrawlConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(SiteReadyProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    // three site-wide checks per audit, several audits may overlap in a batch
    @Bean(name = "checkExecutor", destroyMethod = "shutdown")
    public ExecutorService checkExecutor(SiteReadyProperties properties) {
        int size = Math.max(3, properties.getBatch().getConcurrency() * 3);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "auditRunExecutor", destroyMethod = "shutdown")
    public ExecutorService auditRunExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "batchExecutor", destroyMethod = "shutdown")
    public ExecutorService batchExecutor(SiteReadyProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getBatch().getConcurrency() * 2));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
