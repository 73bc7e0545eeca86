package com.purchasingpower.tendermatch.knowledge;

import com.purchasingpower.tendermatch.model.vector.VectorRecord;

import java.util.Collection;
import java.util.List;

/**
 * Vector store with write access.
 *
 * @since 1.0.0
 */
public interface VectorStore extends VectorLookup {

    void upsert(String namespace, List<VectorRecord> records);

    void delete(String namespace, Collection<String> ids);
}
