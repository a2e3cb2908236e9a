package com.spocparser.ast;

/**
 * Reference to, or set expression over, policy objects.
 */
public sealed interface Element extends Node permits
    NamedRef,
    IntfRef,
    User,
    AutoGroup,
    Intersection,
    Complement {
}
