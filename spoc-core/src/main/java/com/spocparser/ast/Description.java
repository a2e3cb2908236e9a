package com.spocparser.ast;

/**
 * Free-form text following {@code description =} up to end of line.
 * The text is kept verbatim, including its leading blank.
 */
public record Description(
    int start,
    int end,
    String text
) implements Node {

    @Override
    public String type() {
        return "Description";
    }
}
