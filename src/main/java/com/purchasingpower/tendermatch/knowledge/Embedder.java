package com.purchasingpower.tendermatch.knowledge;

import java.util.List;

/**
 * Turns text into a fixed-dimension embedding vector (768 for the configured model).
 *
 * @since 1.0.0
 */
public interface Embedder {

    /**
     * @param text non-blank text
     * @return embedding vector
     * @throws com.purchasingpower.tendermatch.exception.EmbeddingException if the model call fails
     */
    List<Double> embed(String text);

    /**
     * Embeds several texts in one call.
     *
     * @return one vector per input text, same order
     */
    List<List<Double>> embedAll(List<String> texts);
}
