/**
 * Legal document chunking: clause detection, sentence packing and page tracking.
 *
 * <p>Documents are split in two passes:
 * <ul>
 *   <li>Clause pass - numbered clauses, section and schedule headers</li>
 *   <li>Fallback pass - sentence windows with overlap when structure is weak</li>
 * </ul>
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code PageMap} - Resolves any character offset to its {@code [Page N]} page</li>
 *   <li>{@code SentenceSplitter} - Offset-preserving sentence splitting and packing</li>
 *   <li>{@code BoundaryMatcher} - Pluggable clause boundary detection</li>
 *   <li>{@code DocumentChunker} - Entry point for chunking a document</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.tendermatch.chunking;
