package com.spocparser.ast;

import java.util.List;

/**
 * Elements combined with {@code &}. Has at least two members; only
 * members after the first may be a {@link Complement}.
 */
public record Intersection(
    int start,
    int end,
    List<Element> list
) implements Element {

    public Intersection {
        list = List.copyOf(list);
    }

    @Override
    public String type() {
        return "Intersection";
    }
}
