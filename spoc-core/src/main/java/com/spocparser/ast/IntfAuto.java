package com.spocparser.ast;

import java.util.List;

/**
 * {@code interface:[managed & ...].[auto|all]}.
 */
public record IntfAuto(
    int start,
    int end,
    String kind,
    boolean managed,
    List<Element> elements,
    String selector
) implements AutoGroup {

    public IntfAuto {
        elements = List.copyOf(elements);
    }

    @Override
    public String type() {
        return "IntfAuto";
    }
}
