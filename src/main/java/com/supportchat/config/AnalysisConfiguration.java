package com.supportchat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportchat.domain.analysis.Lexicon;
import com.supportchat.domain.analysis.MessageClassifier;
import com.supportchat.domain.context.AggregationPolicy;
import com.supportchat.domain.context.UserContextAggregator;
import com.supportchat.infrastructure.concurrency.UserLockRegistry;
import com.supportchat.infrastructure.lexicon.LexiconLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Wires the framework-free analysis core.
 *
 * The lexicon is read once here and shared, read-only, by every request thread.
 */
@Configuration
@Slf4j
public class AnalysisConfiguration {

    @Bean
    public Lexicon lexicon(SupportProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new LexiconLoader(resourceLoader, objectMapper).load(properties.getLexicon().getLocation());
    }

    @Bean
    public MessageClassifier messageClassifier(Lexicon lexicon) {
        return new MessageClassifier(lexicon);
    }

    @Bean
    public AggregationPolicy aggregationPolicy(SupportProperties properties) {
        SupportProperties.Analysis analysis = properties.getAnalysis();
        AggregationPolicy policy = AggregationPolicy.builder()
            .sentimentWindow(analysis.getSentimentWindow())
            .minimumTrendSample(analysis.getMinimumTrendSample())
            .trendDelta(analysis.getTrendDelta())
            .negativeRatio(analysis.getNegativeRatio())
            .positiveRatio(analysis.getPositiveRatio())
            .topTopics(analysis.getTopTopics())
            .engagementWindow(analysis.getEngagementWindow())
            .minimumEngagementSpan(analysis.getMinimumEngagementSpan())
            .mediumEngagementRate(analysis.getMediumEngagementRate())
            .highEngagementRate(analysis.getHighEngagementRate())
            .build();

        log.info("Aggregation policy: sentimentWindow={}, trendDelta={}, engagementWindow={}",
            policy.getSentimentWindow(), policy.getTrendDelta(), policy.getEngagementWindow());
        return policy;
    }

    @Bean
    public UserContextAggregator userContextAggregator(AggregationPolicy policy) {
        return new UserContextAggregator(policy);
    }

    @Bean
    public UserLockRegistry userLockRegistry(SupportProperties properties) {
        return new UserLockRegistry(properties.getConcurrency().getLockTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
