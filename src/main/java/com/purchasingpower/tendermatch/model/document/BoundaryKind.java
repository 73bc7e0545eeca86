package com.purchasingpower.tendermatch.model.document;

/**
 * Kind of structural marker that starts a clause chunk.
 */
public enum BoundaryKind {
    /**
     * Numbered clause at line start, e.g. {@code 1. Definitions} or {@code 3.2 Payment}.
     */
    NUMBERED_CLAUSE,

    /**
     * {@code SECTION 4}, {@code ARTICLE 2}, {@code CLAUSE 7}.
     */
    SECTION_HEADER,

    /**
     * {@code SCHEDULE 1}, {@code APPENDIX A}, {@code ANNEX B}.
     */
    SCHEDULE
}
