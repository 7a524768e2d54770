package com.supportchat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration under the {@code support} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "support")
public class SupportProperties {

    @Valid
    private Lexicon lexicon = new Lexicon();

    @Valid
    private Analysis analysis = new Analysis();

    @Valid
    private Concurrency concurrency = new Concurrency();

    @Valid
    private Generation generation = new Generation();

    /**
     * Hotline and resource lines surfaced with every crisis reply.
     */
    private List<String> crisisResources = new ArrayList<>(List.of(
        "If you're having thoughts of self-harm, please contact the 988 Suicide & Crisis Lifeline "
            + "by calling or texting 988 (US), or 1-800-273-8255. You're not alone, and help is available 24/7.",
        "If you are in immediate danger, call your local emergency number."
    ));

    @Data
    public static class Lexicon {
        @NotBlank
        private String location = "classpath:lexicon/default-lexicon.json";
    }

    @Data
    public static class Analysis {
        // stored as one character per turn in user_contexts.sentiment_window
        @Min(2)
        @Max(256)
        private int sentimentWindow = 10;

        @Min(1)
        private int minimumTrendSample = 3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double trendDelta = 0.2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double negativeRatio = 0.5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double positiveRatio = 0.3;

        @Min(1)
        private int topTopics = 3;

        @NotNull
        private Duration engagementWindow = Duration.ofHours(24);

        @NotNull
        private Duration minimumEngagementSpan = Duration.ofHours(1);

        @DecimalMin("0.0")
        private double mediumEngagementRate = 1.0;

        @DecimalMin("0.0")
        private double highEngagementRate = 4.0;
    }

    @Data
    public static class Concurrency {
        @NotNull
        private Duration lockTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Generation {
        private String apiKey = "";

        @NotBlank
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

        @NotBlank
        private String model = "gemini-2.0-flash";

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double topP = 1.0;

        @Min(1)
        private int topK = 1;

        @Min(1)
        private int maxOutputTokens = 800;

        @Min(1)
        @Max(100)
        private int historyTurns = 6;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
