package com.purchasingpower.tendermatch.knowledge.impl;

import com.purchasingpower.tendermatch.configuration.AppProperties;
import com.purchasingpower.tendermatch.configuration.OllamaProperties;
import com.purchasingpower.tendermatch.exception.EmbeddingException;
import com.purchasingpower.tendermatch.knowledge.Embedder;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LangChain4j embedding client backed by an Ollama embedding model.
 *
 * Retries and timeouts are handled by the LangChain4j model.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jEmbedder implements Embedder {

    private final EmbeddingModel embeddingModel;

    @Autowired
    public LangChain4jEmbedder(AppProperties props) {
        this(buildModel(props.getOllama()));
    }

    public LangChain4jEmbedder(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    private static EmbeddingModel buildModel(OllamaProperties ollama) {
        log.info("Initializing Ollama embeddings: url={}, model={}, timeout={}s, retries={}",
                ollama.getBaseUrl(), ollama.getEmbeddingModel(),
                ollama.getTimeoutSeconds(), ollama.getMaxRetries());

        return OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        log.debug("Generating embedding (text length: {})", text.length());

        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Double> embedding = toDoubleList(response.content());
            log.debug("Generated embedding ({} dimensions)", embedding.size());
            return embedding;
        } catch (Exception e) {
            log.error("Failed to generate embedding after retries: {}", e.getMessage());
            throw new EmbeddingException("Embedding generation failed", e);
        }
    }

    @Override
    public List<List<Double>> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        log.info("Generating embeddings for {} texts in batch", texts.size());

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .toList();

        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Double>> embeddings = response.content().stream()
                    .map(LangChain4jEmbedder::toDoubleList)
                    .toList();

            if (embeddings.size() != texts.size()) {
                throw new EmbeddingException("Embedding count mismatch: expected "
                        + texts.size() + ", got " + embeddings.size());
            }
            return embeddings;
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            log.error("Batch embedding generation failed after retries: {}", e.getMessage());
            throw new EmbeddingException("Batch embedding generation failed", e);
        }
    }

    private static List<Double> toDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
