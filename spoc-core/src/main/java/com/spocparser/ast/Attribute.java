package com.spocparser.ast;

import java.util.List;

/**
 * Attribute of a service or rule. An empty value list denotes a flag
 * like {@code multi_owner;}.
 */
public record Attribute(
    int start,
    int end,
    String name,
    List<Value> values
) implements Node {

    public Attribute {
        values = List.copyOf(values);
    }

    @Override
    public String type() {
        return "Attribute";
    }
}
