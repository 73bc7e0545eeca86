/**
 * Document upload pipeline: text extraction from PDF and plain text, chunking, embedding and storage.
 *
 * @since 1.0.0
 */
package com.purchasingpower.tendermatch.ingest;
