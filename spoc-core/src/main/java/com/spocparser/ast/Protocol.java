package com.spocparser.ast;

/**
 * Entry of the {@code prt} list of a rule.
 */
public sealed interface Protocol extends Node permits NamedRef, SimpleProtocol {
}
