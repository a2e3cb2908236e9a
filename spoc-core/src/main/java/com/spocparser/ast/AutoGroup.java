package com.spocparser.ast;

import java.util.List;

/**
 * Automatic group: an element whose members are computed from a nested
 * element list, written as {@code kind:[...]}.
 */
public sealed interface AutoGroup extends Element permits SimpleAuto, AggAuto, IntfAuto {

    String kind();
    List<Element> elements();
}
