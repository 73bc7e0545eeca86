package com.purchasingpower.tendermatch.chunking;

import com.purchasingpower.tendermatch.model.document.Boundary;
import com.purchasingpower.tendermatch.model.document.BoundaryKind;

import java.util.List;

/**
 * Finds one kind of structural boundary in legal text.
 *
 * <p>Matchers are independent of each other; the chunker merges their results
 * by ascending offset. Implementations must be stateless.
 */
public interface BoundaryMatcher {

    BoundaryKind kind();

    /**
     * @param text original document text
     * @return boundaries in ascending offset order, offsets relative to {@code text}
     */
    List<Boundary> findBoundaries(String text);
}
