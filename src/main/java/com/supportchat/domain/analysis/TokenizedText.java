package com.supportchat.domain.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.charfilter.MappingCharFilter;
import org.apache.lucene.analysis.charfilter.NormalizeCharMap;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.miscellaneous.KeywordRepeatFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.KeywordAttribute;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized word sequence used for lexicon matching.
 *
 * <p>Text runs through a Lucene chain: apostrophes are removed ("don't" and
 * "don’t" both become "dont"), words are split by {@link StandardTokenizer},
 * lower-cased, and each word is paired with its Porter stem so that
 * "cutting", "stressed" and "suicides" compare equal to "cut", "stress" and
 * "suicide". Lexicon terms and messages go through the same chain.
 */
public final class TokenizedText {

    private static final String FIELD = "text";

    private static final NormalizeCharMap APOSTROPHES = apostrophes();

    // Emits every word twice: first as typed (keyword), then stemmed.
    private static final Analyzer ANALYZER = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer source = new StandardTokenizer();
            TokenStream result = new LowerCaseFilter(source);
            result = new KeywordRepeatFilter(result);
            result = new PorterStemFilter(result);
            return new TokenStreamComponents(source, result);
        }

        @Override
        protected Reader initReader(String fieldName, Reader reader) {
            return new MappingCharFilter(APOSTROPHES, reader);
        }
    };

    private static final TokenizedText EMPTY = new TokenizedText(List.of(), List.of());

    private final List<String> tokens;
    private final List<String> stems;

    private TokenizedText(List<String> tokens, List<String> stems) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.stems = Collections.unmodifiableList(stems);
    }

    public static TokenizedText of(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }

        List<String> tokens = new ArrayList<>();
        List<String> stems = new ArrayList<>();
        try (TokenStream stream = ANALYZER.tokenStream(FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            KeywordAttribute keyword = stream.addAttribute(KeywordAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                if (keyword.isKeyword()) {
                    tokens.add(term.toString());
                } else {
                    stems.add(term.toString());
                }
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to tokenize text", e);
        }

        if (tokens.size() != stems.size()) {
            throw new IllegalStateException("Tokenizer produced " + tokens.size()
                + " words but " + stems.size() + " stems");
        }
        return new TokenizedText(tokens, stems);
    }

    public List<String> tokens() {
        return tokens;
    }

    List<String> stems() {
        return stems;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * Counts non-overlapping occurrences of {@code term} as a consecutive token run.
     */
    public int occurrences(TokenizedText term) {
        int termSize = term.size();
        if (termSize == 0 || termSize > size()) {
            return 0;
        }
        int count = 0;
        int i = 0;
        while (i <= size() - termSize) {
            if (matchesAt(term, i)) {
                count++;
                i += termSize;
            } else {
                i++;
            }
        }
        return count;
    }

    public boolean contains(TokenizedText term) {
        return occurrences(term) > 0;
    }

    private boolean matchesAt(TokenizedText term, int offset) {
        for (int j = 0; j < term.size(); j++) {
            if (!tokens.get(offset + j).equals(term.tokens.get(j))
                    && !stems.get(offset + j).equals(term.stems.get(j))) {
                return false;
            }
        }
        return true;
    }

    private static NormalizeCharMap apostrophes() {
        NormalizeCharMap.Builder builder = new NormalizeCharMap.Builder();
        builder.add("'", "");
        builder.add("’", "");
        builder.add("‘", "");
        return builder.build();
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
