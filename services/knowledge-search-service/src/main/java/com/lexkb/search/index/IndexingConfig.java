package com.lexkb.search.index;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndexProperties.class)
public class IndexingConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexingExecutor(IndexProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutorThreads()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingHook embeddingHook() {
        return EmbeddingHook.NOOP;
    }
}
