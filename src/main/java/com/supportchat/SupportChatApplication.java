package com.supportchat;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the supportive chat backend.
 *
 * <p>The service keeps a per-user conversational context and analyzes every
 * incoming message before a reply is generated:
 *
 * <ul>
 *   <li><strong>Message classification</strong>: crisis tiers, urgency, sentiment, questions and topics</li>
 *   <li><strong>User context</strong>: sentiment trend, common topics, engagement and crisis history</li>
 *   <li><strong>Per-user serialization</strong>: one lock per user, independent users run in parallel</li>
 *   <li><strong>Response generation</strong>: context-aware prompts with safe fallbacks</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Framework-free domain (classifier, aggregator)</li>
 *   <li>Hexagonal architecture (ports and adapters)</li>
 *   <li>Append-only message history with an incrementally folded aggregate</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class SupportChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupportChatApplication.class, args);

        log.info("Support context engine started");
    }
}
