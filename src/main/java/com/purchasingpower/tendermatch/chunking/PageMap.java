package com.purchasingpower.tendermatch.chunking;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Character offset to page number lookup for one document.
 *
 * <p>Built once from the original extracted text, which carries a {@code [Page N]}
 * marker at the start of each page's content. A position resolves to the page of
 * the latest marker at or before it, or page 1 when no marker precedes it.
 *
 * <p>Immutable and safe to share between threads.
 */
public final class PageMap {

    private static final Pattern PAGE_MARKER = Pattern.compile("\\[Page (\\d{1,9})\\]");

    private static final PageMap EMPTY = new PageMap(new TreeMap<>());

    private final NavigableMap<Integer, Integer> markers;

    private PageMap(NavigableMap<Integer, Integer> markers) {
        this.markers = markers;
    }

    /**
     * Scans {@code text} for page markers.
     *
     * @param text original document text, may be null
     * @return the page map; empty when the text has no markers
     */
    public static PageMap fromText(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        NavigableMap<Integer, Integer> markers = new TreeMap<>();
        Matcher matcher = PAGE_MARKER.matcher(text);
        while (matcher.find()) {
            int page = Integer.parseInt(matcher.group(1));
            if (page >= 1) {
                markers.put(matcher.start(), page);
            }
        }
        return markers.isEmpty() ? EMPTY : new PageMap(markers);
    }

    public static PageMap empty() {
        return EMPTY;
    }

    /**
     * Page containing the character at {@code offset} of the original text.
     */
    public int pageAt(int offset) {
        Map.Entry<Integer, Integer> marker = markers.floorEntry(offset);
        return marker == null ? 1 : marker.getValue();
    }

    /**
     * Marker offsets in ascending order, each mapped to its page number.
     */
    public NavigableMap<Integer, Integer> asMap() {
        return Collections.unmodifiableNavigableMap(markers);
    }

    public boolean isEmpty() {
        return markers.isEmpty();
    }

    public int markerCount() {
        return markers.size();
    }

    @Override
    public String toString() {
        return "PageMap" + markers;
    }
}
