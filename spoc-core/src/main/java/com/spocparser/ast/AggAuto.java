package com.spocparser.ast;

import java.util.List;

/**
 * {@code any:[...]}, optionally restricted by {@code ip = prefix &}.
 * {@code net} is null without restriction.
 */
public record AggAuto(
    int start,
    int end,
    String kind,
    IpPrefix net,
    List<Element> elements
) implements AutoGroup {

    public AggAuto {
        elements = List.copyOf(elements);
    }

    @Override
    public String type() {
        return "AggAuto";
    }
}
