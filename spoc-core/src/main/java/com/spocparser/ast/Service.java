package com.spocparser.ast;

import java.util.List;

public record Service(
    int start,
    int end,
    String name,
    Description description,
    List<Attribute> attributes,
    boolean foreach,
    List<Element> user,
    List<Rule> rules,
    String fileName
) implements Toplevel {

    public Service {
        attributes = List.copyOf(attributes);
        user = List.copyOf(user);
        rules = List.copyOf(rules);
    }

    @Override
    public boolean isList() {
        return false;
    }

    @Override
    public String type() {
        return "Service";
    }
}
