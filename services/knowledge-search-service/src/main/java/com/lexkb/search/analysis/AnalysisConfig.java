package com.lexkb.search.analysis;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AnalyzerProperties.class)
public class AnalysisConfig {

    @Bean
    public LegalDictionary legalDictionary(LegalDictionaryLoader loader, AnalyzerProperties properties) {
        return loader.load(properties);
    }

    @Bean
    public LegalTextAnalyzer legalTextAnalyzer(LegalDictionary legalDictionary) {
        return new LegalTextAnalyzer(legalDictionary);
    }

    @Bean
    public LegalEntityExtractor legalEntityExtractor(LegalDictionary legalDictionary) {
        return new LegalEntityExtractor(legalDictionary);
    }
}
