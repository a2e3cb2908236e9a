package com.spocparser.ast;

public record Value(
    int start,
    int end,
    String value
) implements Node {

    @Override
    public String type() {
        return "Value";
    }
}
