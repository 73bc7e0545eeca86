package com.purchasingpower.tendermatch.chunking;

/**
 * A trimmed piece of document text and the offset of its first character in the original text.
 */
public record TextSpan(String text, int offset) {

    public int length() {
        return text.length();
    }
}
