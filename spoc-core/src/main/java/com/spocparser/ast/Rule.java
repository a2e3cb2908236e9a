package com.spocparser.ast;

import java.util.List;

/**
 * A permit or deny rule of a service. {@code log} is null if the rule has
 * no log attribute.
 */
public record Rule(
    int start,
    int end,
    boolean deny,
    List<Element> src,
    List<Element> dst,
    List<Protocol> prt,
    Attribute log
) implements Node {

    public Rule {
        src = List.copyOf(src);
        dst = List.copyOf(dst);
        prt = List.copyOf(prt);
    }

    @Override
    public String type() {
        return "Rule";
    }
}
