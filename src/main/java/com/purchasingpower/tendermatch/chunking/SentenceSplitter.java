package com.purchasingpower.tendermatch.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence segmentation and size-bounded packing of sentences into chunks.
 *
 * <p>A sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace.
 * Every produced {@link TextSpan} keeps its absolute offset so page numbers can
 * be resolved against the original document.
 */
public final class SentenceSplitter {

    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private SentenceSplitter() {
    }

    /**
     * Splits {@code text} into trimmed, non-empty sentences.
     *
     * @param text       text to split
     * @param baseOffset offset of {@code text} within the original document
     */
    public static List<TextSpan> split(String text, int baseOffset) {
        List<TextSpan> sentences = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return sentences;
        }
        Matcher matcher = SENTENCE_BREAK.matcher(text);
        int start = 0;
        while (matcher.find()) {
            addTrimmed(sentences, text, start, matcher.start(), baseOffset);
            start = matcher.end();
        }
        addTrimmed(sentences, text, start, text.length(), baseOffset);
        return sentences;
    }

    /**
     * Breaks any span longer than {@code maxLength} at whitespace, or hard at
     * {@code maxLength} when a run has no whitespace.
     */
    public static List<TextSpan> limitLength(List<TextSpan> spans, int maxLength) {
        List<TextSpan> limited = new ArrayList<>(spans.size());
        for (TextSpan span : spans) {
            if (span.length() <= maxLength) {
                limited.add(span);
            } else {
                breakLongSpan(limited, span, maxLength);
            }
        }
        return limited;
    }

    /**
     * Packs spans in order into groups whose space-joined length stays within
     * {@code maxLength}. After each full group, the last {@code overlap} spans are
     * carried into the next group when the group holds more than {@code overlap}
     * spans and the carry still leaves room for the incoming span.
     *
     * <p>Spans must already be limited to {@code maxLength}.
     */
    public static List<List<TextSpan>> pack(List<TextSpan> spans, int maxLength, int overlap) {
        return pack(spans, maxLength, overlap, 0);
    }

    /**
     * Like {@link #pack(List, int, int)}, but a group shorter than {@code minLength}
     * is never closed on its own: the head of the incoming span is broken off at
     * whitespace and appended to it, leaving at least {@code minLength} characters
     * in the remainder. Only the last group can end up shorter than {@code minLength}.
     */
    public static List<List<TextSpan>> pack(List<TextSpan> spans, int maxLength, int overlap, int minLength) {
        List<List<TextSpan>> groups = new ArrayList<>();
        List<TextSpan> current = new ArrayList<>();
        int currentLength = 0;

        for (TextSpan next : spans) {
            TextSpan span = next;
            if (!current.isEmpty() && currentLength + 1 + span.length() > maxLength) {
                if (currentLength < minLength) {
                    int room = maxLength - currentLength - 1;
                    List<TextSpan> parts = splitHead(span, Math.min(room, span.length() - minLength), minLength);
                    if (parts.size() == 2) {
                        current.add(parts.get(0));
                        span = parts.get(1);
                    }
                }
                groups.add(List.copyOf(current));

                List<TextSpan> carry = overlap > 0 && current.size() > overlap
                        ? new ArrayList<>(current.subList(current.size() - overlap, current.size()))
                        : new ArrayList<>();
                current = carry;
                currentLength = joinedLength(current);
                if (!current.isEmpty() && currentLength + 1 + span.length() > maxLength) {
                    current.clear();
                    currentLength = 0;
                }
            }
            currentLength = current.isEmpty() ? span.length() : currentLength + 1 + span.length();
            current.add(span);
        }

        if (!current.isEmpty()) {
            groups.add(List.copyOf(current));
        }
        return groups;
    }

    /**
     * Length of the spans joined with single spaces.
     */
    public static int joinedLength(List<TextSpan> spans) {
        if (spans.isEmpty()) {
            return 0;
        }
        int length = spans.size() - 1;
        for (TextSpan span : spans) {
            length += span.length();
        }
        return length;
    }

    public static String join(List<TextSpan> spans) {
        StringBuilder text = new StringBuilder(joinedLength(spans));
        for (TextSpan span : spans) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(span.text());
        }
        return text.toString();
    }

    private static void breakLongSpan(List<TextSpan> out, TextSpan span, int maxLength) {
        String text = span.text();
        int pos = 0;
        while (text.length() - pos > maxLength) {
            int cut = pos + maxLength;
            int end = cut;
            for (int i = cut; i > pos; i--) {
                if (Character.isWhitespace(text.charAt(i))) {
                    end = i;
                    break;
                }
            }
            addTrimmed(out, text, pos, end, span.offset());
            pos = end;
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
        addTrimmed(out, text, pos, text.length(), span.offset());
    }

    /**
     * Breaks {@code span} at the last whitespace at or before {@code maxHead} whose
     * remainder keeps at least {@code minRest} characters. Returns the span alone
     * when there is no such break.
     */
    private static List<TextSpan> splitHead(TextSpan span, int maxHead, int minRest) {
        String text = span.text();
        for (int cut = Math.min(maxHead, text.length() - 1); cut > 0; cut--) {
            if (!Character.isWhitespace(text.charAt(cut))) {
                continue;
            }
            int restStart = cut;
            while (restStart < text.length() && Character.isWhitespace(text.charAt(restStart))) {
                restStart++;
            }
            if (text.length() - restStart < minRest) {
                continue;
            }
            List<TextSpan> parts = new ArrayList<>(2);
            addTrimmed(parts, text, 0, cut, span.offset());
            addTrimmed(parts, text, restStart, text.length(), span.offset());
            if (parts.size() == 2) {
                return parts;
            }
        }
        return List.of(span);
    }

    private static void addTrimmed(List<TextSpan> out, String text, int start, int end, int baseOffset) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            out.add(new TextSpan(text.substring(start, end), baseOffset + start));
        }
    }
}
