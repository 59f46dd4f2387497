package com.lexkb.search.suggest;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SuggestProperties.class)
public class SuggestConfig {
}
