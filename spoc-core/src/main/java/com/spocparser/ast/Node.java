package com.spocparser.ast;

/**
 * Base interface for all nodes of the policy AST.
 *
 * <p>{@code start} and {@code end} are character offsets into the source the
 * node was parsed from: {@code start} is the first character of the node's
 * first token, {@code end} is just behind its last token. They are only used
 * to recover comments when printing.</p>
 */
public sealed interface Node permits
    Toplevel,
    Element,
    Protocol,
    Attribute,
    Value,
    Rule,
    Description {

    String type();
    int start();
    int end();
}
