package com.spocparser.ast;

public record Complement(
    int start,
    int end,
    Element element
) implements Element {

    @Override
    public String type() {
        return "Complement";
    }
}
