package com.spocparser.ast;

/**
 * Direct reference {@code kind:name}, e.g. {@code host:h1}. Also used for
 * {@code protocol:} and {@code protocolgroup:} references in rules.
 */
public record NamedRef(
    int start,
    int end,
    String kind,
    String name
) implements Element, Protocol {

    public NamedRef(String kind, String name) {
        this(0, 0, kind, name);
    }

    @Override
    public String type() {
        return "NamedRef";
    }
}
