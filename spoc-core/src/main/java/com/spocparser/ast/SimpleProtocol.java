package com.spocparser.ast;

import java.util.List;

/**
 * {@code tcp}, {@code udp}, {@code icmp} or {@code proto} with the
 * following tokens kept verbatim, e.g. {@code tcp 80-90}.
 */
public record SimpleProtocol(
    int start,
    int end,
    String proto,
    List<String> details
) implements Protocol {

    public SimpleProtocol {
        details = List.copyOf(details);
    }

    @Override
    public String type() {
        return "SimpleProtocol";
    }
}
