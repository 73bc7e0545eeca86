package com.purchasingpower.tendermatch.knowledge;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read side of the vector store: fetches stored vectors by id.
 *
 * @since 1.0.0
 */
public interface VectorLookup {

    /**
     * @param namespace store namespace (contracts, capabilities, documents)
     * @param ids       record ids; blank ids are ignored
     * @return vectors by id; ids with no stored record are absent from the map
     */
    Map<String, List<Double>> fetch(String namespace, Collection<String> ids);
}
