package com.lexkb.search.recommend;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RecommendProperties.class)
public class RecommendConfig {

    @Bean
    @ConditionalOnMissingBean(InteractionHistoryProvider.class)
    public InMemoryInteractionHistory interactionHistory(RecommendProperties properties) {
        return new InMemoryInteractionHistory(properties.getMaxEventsPerUser());
    }
}
