package com.supportchat.domain.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable keyword tables used by the {@link MessageClassifier}.
 *
 * <p>Three tables map terms to categories: crisis terms to a {@link CrisisTier},
 * sentiment terms to a {@link SentimentPolarity}, and topic terms to a topic
 * label. Terms are tokenized once at construction; lookups never mutate state,
 * so a single instance is safely shared by all request threads.
 *
 * <p>An empty lexicon is valid and simply matches nothing.
 */
public final class Lexicon {

    private static final Lexicon EMPTY = new Lexicon(Map.of(), Map.of(), Map.of());

    private final List<Entry<CrisisTier>> crisisTerms;
    private final List<Entry<SentimentPolarity>> sentimentTerms;
    private final List<Entry<String>> topicTerms;

    public Lexicon(
            Map<String, CrisisTier> crisisTerms,
            Map<String, SentimentPolarity> sentimentTerms,
            Map<String, String> topicTerms) {

        this.crisisTerms = compile(crisisTerms);
        this.sentimentTerms = compile(sentimentTerms);
        this.topicTerms = compile(topicTerms);
    }

    public static Lexicon empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return crisisTerms.isEmpty() && sentimentTerms.isEmpty() && topicTerms.isEmpty();
    }

    /**
     * Crisis detection cannot run without crisis terms.
     */
    public boolean hasCrisisTerms() {
        return !crisisTerms.isEmpty();
    }

    public int size() {
        return crisisTerms.size() + sentimentTerms.size() + topicTerms.size();
    }

    /**
     * Highest crisis tier among all matching crisis terms.
     */
    public Optional<CrisisTier> highestCrisisTier(TokenizedText text) {
        CrisisTier highest = null;
        for (Entry<CrisisTier> entry : crisisTerms) {
            if ((highest == null || entry.value.compareTo(highest) > 0) && text.contains(entry.term)) {
                highest = entry.value;
            }
        }
        return Optional.ofNullable(highest);
    }

    /**
     * Number of occurrences of terms with the given polarity.
     */
    public int countSentiment(TokenizedText text, SentimentPolarity polarity) {
        int count = 0;
        for (Entry<SentimentPolarity> entry : sentimentTerms) {
            if (entry.value == polarity) {
                count += text.occurrences(entry.term);
            }
        }
        return count;
    }

    /**
     * Distinct topic labels mentioned in the text, in label order.
     */
    public Set<String> topicsIn(TokenizedText text) {
        Set<String> topics = new TreeSet<>();
        for (Entry<String> entry : topicTerms) {
            if (!topics.contains(entry.value) && text.contains(entry.term)) {
                topics.add(entry.value);
            }
        }
        return Collections.unmodifiableSet(topics);
    }

    private static <T> List<Entry<T>> compile(Map<String, T> terms) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        List<Entry<T>> compiled = new ArrayList<>(terms.size());
        terms.forEach((term, value) -> {
            if (term == null || value == null) {
                return;
            }
            TokenizedText tokens = TokenizedText.of(term);
            if (!tokens.isEmpty()) {
                compiled.add(new Entry<>(tokens, value));
            }
        });
        return Collections.unmodifiableList(compiled);
    }

    private static final class Entry<T> {
        private final TokenizedText term;
        private final T value;

        private Entry(TokenizedText term, T value) {
            this.term = term;
            this.value = value;
        }
    }
}
