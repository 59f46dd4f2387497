package com.lexkb.search.analysis;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

@Component
public class LegalDictionaryLoader {
    private static final Logger log = LoggerFactory.getLogger(LegalDictionaryLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    public LegalDictionary load(AnalyzerProperties properties) {
        Map<String, Object> root = readRoot(properties.getDictionaryPath(), properties.isStrict());

        Set<String> stopwords = new LinkedHashSet<>();
        Set<String> legalKeywords = new LinkedHashSet<>();
        Set<String> words = new LinkedHashSet<>();
        List<Set<String>> synonyms = new ArrayList<>();

        collect(root.get("stopwords"), stopwords);
        collect(root.get("legal_keywords"), legalKeywords);
        collect(root.get("words"), words);
        Object rawSynonyms = root.get("synonyms");
        if (rawSynonyms instanceof List<?> groups) {
            for (Object group : groups) {
                Set<String> values = new LinkedHashSet<>();
                collect(group, values);
                synonyms.add(values);
            }
        }

        collect(properties.getExtraStopwords(), stopwords);
        collect(properties.getExtraLegalKeywords(), legalKeywords);
        collect(properties.getExtraWords(), words);
        if (properties.getExtraSynonyms() != null) {
            for (List<String> group : properties.getExtraSynonyms()) {
                Set<String> values = new LinkedHashSet<>();
                collect(group, values);
                synonyms.add(values);
            }
        }

        String version = asString(root.get("version"), "unversioned");
        LegalDictionary dictionary = new LegalDictionary(
            version,
            stopwords,
            legalKeywords,
            words,
            synonyms,
            properties.getMaxWordLength()
        );
        log.info(
            "legal dictionary loaded version={} words={} stopwords={} legal_keywords={} synonym_groups={}",
            version,
            dictionary.getWords().size(),
            dictionary.getStopwords().size(),
            dictionary.getLegalKeywords().size(),
            dictionary.getSynonymGroups().size()
        );
        return dictionary;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readRoot(String location, boolean strict) {
        if (location == null || location.isBlank()) {
            return Map.of();
        }
        try (InputStream input = open(location)) {
            if (input == null) {
                if (strict) {
                    throw new IllegalStateException("legal dictionary not found: " + location);
                }
                log.warn("legal dictionary not found at {}", location);
                return Map.of();
            }
            Object parsed = new Yaml().load(input);
            if (!(parsed instanceof Map<?, ?> map)) {
                if (strict) {
                    throw new IllegalStateException("legal dictionary malformed (root not map): " + location);
                }
                log.warn("legal dictionary malformed (root not map)");
                return Map.of();
            }
            return (Map<String, Object>) map;
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            if (strict) {
                throw new IllegalStateException("legal dictionary load failed: " + location, ex);
            }
            log.warn("legal dictionary load failed", ex);
            return Map.of();
        }
    }

    private InputStream open(String location) throws Exception {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            return LegalDictionaryLoader.class.getClassLoader().getResourceAsStream(resource);
        }
        Path resolved = resolvePath(location);
        if (!Files.exists(resolved)) {
            return null;
        }
        return Files.newInputStream(resolved);
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }

    private void collect(Object raw, Set<String> target) {
        if (!(raw instanceof Iterable<?> items)) {
            return;
        }
        for (Object item : items) {
            String value = asString(item, null);
            if (value != null) {
                target.add(value.toLowerCase(Locale.ROOT));
            }
        }
    }

    private String asString(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? fallback : value;
    }
}
