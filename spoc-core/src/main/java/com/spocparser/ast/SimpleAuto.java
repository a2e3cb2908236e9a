package com.spocparser.ast;

import java.util.List;

/**
 * {@code host:[...]} or {@code network:[...]}.
 */
public record SimpleAuto(
    int start,
    int end,
    String kind,
    List<Element> elements
) implements AutoGroup {

    public SimpleAuto {
        elements = List.copyOf(elements);
    }

    @Override
    public String type() {
        return "SimpleAuto";
    }
}
