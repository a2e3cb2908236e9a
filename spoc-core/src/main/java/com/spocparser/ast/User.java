package com.spocparser.ast;

public record User(
    int start,
    int end
) implements Element {

    @Override
    public String type() {
        return "User";
    }
}
