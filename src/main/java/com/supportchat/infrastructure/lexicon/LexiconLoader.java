package com.supportchat.infrastructure.lexicon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportchat.domain.analysis.CrisisTier;
import com.supportchat.domain.analysis.Lexicon;
import com.supportchat.domain.analysis.SentimentPolarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads the keyword tables from a JSON resource:
 *
 * <pre>
 * {
 *   "crisis":    { "end it all": "imminent", ... },
 *   "sentiment": { "hopeless": "negative", ... },
 *   "topics":    { "insomnia": "sleep", ... }
 * }
 * </pre>
 *
 * A missing or unreadable resource yields an empty lexicon rather than a
 * startup failure; entries with an unknown tier or polarity are skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class LexiconLoader {

    private static final TypeReference<Map<String, Map<String, String>>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public Lexicon load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Lexicon resource not found: {} - classification will run in degraded mode", location);
            return Lexicon.empty();
        }

        Map<String, Map<String, String>> document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, DOCUMENT_TYPE);
        } catch (IOException e) {
            log.error("Lexicon resource unreadable: {} - classification will run in degraded mode", location, e);
            return Lexicon.empty();
        }
        if (document == null) {
            log.error("Lexicon resource is empty: {} - classification will run in degraded mode", location);
            return Lexicon.empty();
        }

        Lexicon lexicon = new Lexicon(
            table(document, "crisis", CrisisTier::fromValue),
            table(document, "sentiment", SentimentPolarity::fromValue),
            table(document, "topics", Function.identity())
        );

        if (!lexicon.hasCrisisTerms()) {
            log.error("Lexicon {} defines no crisis terms - crisis detection disabled", location);
        }
        log.info("Lexicon loaded from {}: {} terms", location, lexicon.size());
        return lexicon;
    }

    private static <T> Map<String, T> table(
            Map<String, Map<String, String>> document, String name, Function<String, T> parser) {

        Map<String, String> raw = document.get(name);
        Map<String, T> parsed = new LinkedHashMap<>();
        if (raw == null) {
            log.warn("Lexicon table '{}' missing", name);
            return parsed;
        }
        raw.forEach((term, value) -> {
            if (term == null || term.isBlank() || value == null || value.isBlank()) {
                log.warn("Skipping blank lexicon entry in table '{}'", name);
                return;
            }
            try {
                parsed.put(term, parser.apply(value));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping lexicon entry '{}' in table '{}': unknown value '{}'", term, name, value);
            }
        });
        return parsed;
    }
}
