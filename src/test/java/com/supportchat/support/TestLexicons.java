package com.supportchat.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportchat.domain.analysis.Lexicon;
import com.supportchat.infrastructure.lexicon.LexiconLoader;
import org.springframework.core.io.DefaultResourceLoader;

public final class TestLexicons {

    private static final Lexicon DEFAULT = new LexiconLoader(new DefaultResourceLoader(), new ObjectMapper())
        .load("classpath:lexicon/default-lexicon.json");

    private TestLexicons() {
    }

    /**
     * The lexicon shipped with the application.
     */
    public static Lexicon defaultLexicon() {
        return DEFAULT;
    }
}
