package com.supportchat.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SupportPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertTrue(validator.validate(new SupportProperties()).isEmpty());
    }

    @Test
    void sentimentWindowMustFitStoredColumn() {
        SupportProperties properties = new SupportProperties();
        properties.getAnalysis().setSentimentWindow(256);
        assertTrue(validator.validate(properties).isEmpty());

        properties.getAnalysis().setSentimentWindow(257);

        assertEquals(Set.of("analysis.sentimentWindow"), violatedPaths(properties));
    }

    @Test
    void promptHistoryIsBoundedByHistoryPageSize() {
        SupportProperties properties = new SupportProperties();
        properties.getGeneration().setHistoryTurns(101);

        assertEquals(Set.of("generation.historyTurns"), violatedPaths(properties));
    }

    private static Set<String> violatedPaths(SupportProperties properties) {
        return validator.validate(properties).stream()
            .map(ConstraintViolation::getPropertyPath)
            .map(Object::toString)
            .collect(Collectors.toSet());
    }
}
