package com.spocparser.ast;

import java.util.List;

public record Group(
    int start,
    int end,
    String name,
    Description description,
    List<Element> elements,
    String fileName
) implements Toplevel {

    public Group {
        elements = List.copyOf(elements);
    }

    public Group(String name, List<Element> elements) {
        this(0, 0, name, null, elements, null);
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public String type() {
        return "Group";
    }
}
