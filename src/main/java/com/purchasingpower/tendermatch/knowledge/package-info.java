/**
 * Embeddings and vector storage.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code Embedder} - Text to vector</li>
 *   <li>{@code VectorStore} - Namespaced upsert, fetch and delete</li>
 *   <li>{@code EmbeddingResolver} - Attaches stored vectors before scoring</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.tendermatch.knowledge;
