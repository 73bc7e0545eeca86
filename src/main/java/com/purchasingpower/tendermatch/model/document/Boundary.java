package com.purchasingpower.tendermatch.model.document;

import lombok.Value;

/**
 * A detected structural boundary: character offset into the original text and what was found there.
 */
@Value
public class Boundary {
    int offset;
    BoundaryKind kind;
}
