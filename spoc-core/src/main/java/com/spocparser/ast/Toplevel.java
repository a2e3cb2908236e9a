package com.spocparser.ast;

/**
 * A named definition at the top level of a source file.
 */
public sealed interface Toplevel extends Node permits Group, Service {

    /**
     * Full typed name, e.g. {@code group:g1}.
     */
    String name();

    /**
     * Optional description, may be null.
     */
    Description description();

    /**
     * Name of the file this definition was read from.
     */
    String fileName();

    /**
     * Whether the definition is a plain element list ({@code name = ...;})
     * or a block ({@code name = { ... }}).
     */
    boolean isList();
}
