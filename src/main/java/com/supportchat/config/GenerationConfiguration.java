package com.supportchat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportchat.application.SupportPromptBuilder;
import com.supportchat.infrastructure.generation.GeminiResponseGenerator;
import com.supportchat.infrastructure.generation.ResponseGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * HTTP client and adapter for reply generation.
 */
@Configuration
@Slf4j
public class GenerationConfiguration {

    @Bean
    public RestTemplate generationRestTemplate(SupportProperties properties) {
        SupportProperties.Generation settings = properties.getGeneration();

        // Redirects are not followed: the API key header must only reach the configured host.
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout((int) settings.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) settings.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }

    @Bean
    @ConditionalOnMissingBean(ResponseGenerator.class)
    public ResponseGenerator responseGenerator(RestTemplate generationRestTemplate, ObjectMapper objectMapper,
                                               SupportProperties properties) {
        GeminiResponseGenerator generator =
            new GeminiResponseGenerator(generationRestTemplate, objectMapper, properties.getGeneration());
        if (generator.isAvailable()) {
            log.info("Reply generation enabled: model={}", properties.getGeneration().getModel());
        } else {
            log.warn("No generation API key configured - replies will use the fallback text");
        }
        return generator;
    }

    @Bean
    public SupportPromptBuilder supportPromptBuilder(SupportProperties properties) {
        return new SupportPromptBuilder(properties.getGeneration().getHistoryTurns());
    }
}
