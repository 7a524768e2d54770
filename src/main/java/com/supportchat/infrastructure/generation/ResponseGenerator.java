package com.supportchat.infrastructure.generation;

/**
 * Port to the language model that writes supportive replies.
 */
public interface ResponseGenerator {

    /**
     * Whether the generator is configured to be called at all.
     */
    boolean isAvailable();

    /**
     * Generate a reply for a fully assembled prompt.
     *
     * @param prompt prompt text including instructions, profile and history
     * @return generated reply, possibly blank
     * @throws GenerationException if the model could not be reached or answered with an error
     */
    String generate(String prompt);
}
