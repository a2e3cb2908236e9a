package com.spocparser;

/**
 * Token delivered by the {@link Scanner}: its start offset in the source
 * and its literal text. The text is empty at end of input.
 */
public record Token(int pos, String text) {

    public int end() {
        return pos + text.length();
    }

    public boolean isEof() {
        return text.isEmpty();
    }
}
