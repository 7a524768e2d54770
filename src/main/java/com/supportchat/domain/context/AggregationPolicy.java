package com.supportchat.domain.context;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed parameters of the per-user fold.
 *
 * <p>Changing a window size changes which state the fold retains, so an
 * aggregate is only reproducible by replay under the same policy.
 */
@Value
public class AggregationPolicy {

    int sentimentWindow;
    int minimumTrendSample;
    double trendDelta;
    double negativeRatio;
    double positiveRatio;
    int topTopics;
    Duration engagementWindow;
    Duration minimumEngagementSpan;
    double mediumEngagementRate;
    double highEngagementRate;

    @Builder
    private AggregationPolicy(
            Integer sentimentWindow,
            Integer minimumTrendSample,
            Double trendDelta,
            Double negativeRatio,
            Double positiveRatio,
            Integer topTopics,
            Duration engagementWindow,
            Duration minimumEngagementSpan,
            Double mediumEngagementRate,
            Double highEngagementRate) {

        this.sentimentWindow = Objects.requireNonNullElse(sentimentWindow, 10);
        this.minimumTrendSample = Objects.requireNonNullElse(minimumTrendSample, 3);
        this.trendDelta = Objects.requireNonNullElse(trendDelta, 0.2);
        this.negativeRatio = Objects.requireNonNullElse(negativeRatio, 0.5);
        this.positiveRatio = Objects.requireNonNullElse(positiveRatio, 0.3);
        this.topTopics = Objects.requireNonNullElse(topTopics, 3);
        this.engagementWindow = Objects.requireNonNullElse(engagementWindow, Duration.ofHours(24));
        this.minimumEngagementSpan = Objects.requireNonNullElse(minimumEngagementSpan, Duration.ofHours(1));
        this.mediumEngagementRate = Objects.requireNonNullElse(mediumEngagementRate, 1.0);
        this.highEngagementRate = Objects.requireNonNullElse(highEngagementRate, 4.0);
        validate();
    }

    public static AggregationPolicy defaults() {
        return AggregationPolicy.builder().build();
    }

    private void validate() {
        if (sentimentWindow < 2) {
            throw new IllegalArgumentException("Sentiment window must hold at least 2 messages");
        }
        if (minimumTrendSample < 1 || minimumTrendSample > sentimentWindow) {
            throw new IllegalArgumentException("Minimum trend sample must be between 1 and the sentiment window");
        }
        if (trendDelta < 0.0 || trendDelta > 1.0) {
            throw new IllegalArgumentException("Trend delta must be within [0, 1]");
        }
        if (positiveRatio > negativeRatio) {
            throw new IllegalArgumentException("Positive ratio threshold must not exceed negative ratio threshold");
        }
        if (topTopics < 1) {
            throw new IllegalArgumentException("Top topics must be at least 1");
        }
        if (engagementWindow.isNegative() || engagementWindow.isZero()) {
            throw new IllegalArgumentException("Engagement window must be positive");
        }
        if (minimumEngagementSpan.isNegative() || minimumEngagementSpan.isZero()
                || minimumEngagementSpan.compareTo(engagementWindow) > 0) {
            throw new IllegalArgumentException("Minimum engagement span must be positive and within the engagement window");
        }
        if (mediumEngagementRate > highEngagementRate) {
            throw new IllegalArgumentException("Medium engagement rate must not exceed high engagement rate");
        }
    }
}
