package com.supportchat.domain.analysis;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless classifier turning one message's text into a {@link MessageAnalysis}.
 *
 * <p>{@link #classify(String)} is a total, pure function of its input: no
 * history, no clock, no I/O. The only shared state is the immutable
 * {@link Lexicon}.
 *
 * <p><strong>Crisis policy (fail-closed):</strong>
 * <ul>
 *   <li>any imminent-tier match: crisis, {@link UrgencyLevel#CRITICAL}</li>
 *   <li>otherwise any severe-tier match: crisis, {@link UrgencyLevel#HIGH}</li>
 *   <li>otherwise any moderate-tier match: not a crisis, {@link UrgencyLevel#MEDIUM}</li>
 *   <li>no match: {@link UrgencyLevel#LOW}</li>
 * </ul>
 * Negation and surrounding words are ignored, so a phrase that contains a crisis
 * term is never classified below that term's tier.
 */
@Slf4j
public class MessageClassifier {

    private final Lexicon lexicon;

    public MessageClassifier(Lexicon lexicon) {
        this.lexicon = Objects.requireNonNull(lexicon, "Lexicon must not be null");
    }

    public MessageAnalysis classify(String text) {
        String trimmed = text == null ? "" : text.strip();
        boolean degraded = !lexicon.hasCrisisTerms();
        if (degraded) {
            log.warn("Crisis lexicon unavailable - classifying in degraded mode, crisis detection disabled");
        }

        int length = trimmed.codePointCount(0, trimmed.length());
        boolean question = trimmed.indexOf('?') >= 0;

        if (trimmed.isEmpty()) {
            return MessageAnalysis.builder()
                .urgencyLevel(UrgencyLevel.LOW)
                .messageLength(0)
                .degraded(degraded)
                .build();
        }

        TokenizedText tokens = TokenizedText.of(trimmed);

        Optional<CrisisTier> tier = lexicon.highestCrisisTier(tokens);
        UrgencyLevel urgency = tier.map(CrisisTier::urgency).orElse(UrgencyLevel.LOW);
        boolean crisis = tier.map(CrisisTier::isCrisis).orElse(false);

        int negativeCount = lexicon.countSentiment(tokens, SentimentPolarity.NEGATIVE);
        int positiveCount = lexicon.countSentiment(tokens, SentimentPolarity.POSITIVE);

        Set<String> topics = lexicon.topicsIn(tokens);

        return MessageAnalysis.builder()
            .crisis(crisis)
            .urgencyLevel(urgency)
            .crisisTier(tier.orElse(null))
            .negative(negativeCount > positiveCount)
            .positive(positiveCount > negativeCount)
            .messageLength(length)
            .question(question)
            .topics(topics)
            .degraded(degraded)
            .build();
    }

    public Lexicon getLexicon() {
        return lexicon;
    }
}
