package com.purchasingpower.tendermatch.chunking.impl;

import com.purchasingpower.tendermatch.chunking.BoundaryMatcher;
import com.purchasingpower.tendermatch.model.document.Boundary;
import com.purchasingpower.tendermatch.model.document.BoundaryKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-backed {@link BoundaryMatcher}. Patterns are anchored at line start
 * ({@link Pattern#MULTILINE}); the boundary offset is the match start.
 */
public class PatternBoundaryMatcher implements BoundaryMatcher {

    // "1. Title", "3.2 Title", "4.1.2. Title"
    private static final Pattern NUMBERED_CLAUSE =
            Pattern.compile("^\\s*\\d+\\.(?:\\d+\\.?)*\\s+[A-Z]", Pattern.MULTILINE);

    private static final Pattern SECTION_HEADER =
            Pattern.compile("^\\s*(?:SECTION|ARTICLE|CLAUSE)\\s+\\d+",
                    Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private static final Pattern SCHEDULE =
            Pattern.compile("^\\s*(?:SCHEDULE|APPENDIX|ANNEX)\\s+[A-Z0-9]",
                    Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private final BoundaryKind kind;
    private final Pattern pattern;

    public PatternBoundaryMatcher(BoundaryKind kind, Pattern pattern) {
        this.kind = kind;
        this.pattern = pattern;
    }

    public static PatternBoundaryMatcher numberedClause() {
        return new PatternBoundaryMatcher(BoundaryKind.NUMBERED_CLAUSE, NUMBERED_CLAUSE);
    }

    public static PatternBoundaryMatcher sectionHeader() {
        return new PatternBoundaryMatcher(BoundaryKind.SECTION_HEADER, SECTION_HEADER);
    }

    public static PatternBoundaryMatcher schedule() {
        return new PatternBoundaryMatcher(BoundaryKind.SCHEDULE, SCHEDULE);
    }

    /**
     * Numbered clauses, section headers and schedule headers, in that order.
     * When two matchers hit the same offset the earlier one names the boundary.
     */
    public static List<BoundaryMatcher> defaults() {
        return List.of(numberedClause(), sectionHeader(), schedule());
    }

    @Override
    public BoundaryKind kind() {
        return kind;
    }

    @Override
    public List<Boundary> findBoundaries(String text) {
        List<Boundary> boundaries = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            boundaries.add(new Boundary(matcher.start(), kind));
        }
        return boundaries;
    }
}
