package com.spocparser.ast;

/**
 * Interface reference {@code interface:router.network[.extension]}.
 * {@code extension} is null if absent. For {@code interface:router.[auto]}
 * the network is empty and the extension holds the selector.
 */
public record IntfRef(
    int start,
    int end,
    String kind,
    String router,
    String network,
    String extension
) implements Element {

    public boolean hasSelector() {
        return network.isEmpty();
    }

    @Override
    public String type() {
        return "IntfRef";
    }
}
