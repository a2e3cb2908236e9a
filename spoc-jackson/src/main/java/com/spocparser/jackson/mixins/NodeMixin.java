package com.spocparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.spocparser.ast.*;

/**
 * Polymorphic type handling for the AST: every node is written with its
 * record name in the "type" property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Group.class, name = "Group"),
    @JsonSubTypes.Type(value = Service.class, name = "Service"),
    @JsonSubTypes.Type(value = Description.class, name = "Description"),
    @JsonSubTypes.Type(value = Attribute.class, name = "Attribute"),
    @JsonSubTypes.Type(value = Value.class, name = "Value"),
    @JsonSubTypes.Type(value = Rule.class, name = "Rule"),
    @JsonSubTypes.Type(value = NamedRef.class, name = "NamedRef"),
    @JsonSubTypes.Type(value = IntfRef.class, name = "IntfRef"),
    @JsonSubTypes.Type(value = User.class, name = "User"),
    @JsonSubTypes.Type(value = SimpleAuto.class, name = "SimpleAuto"),
    @JsonSubTypes.Type(value = AggAuto.class, name = "AggAuto"),
    @JsonSubTypes.Type(value = IntfAuto.class, name = "IntfAuto"),
    @JsonSubTypes.Type(value = Intersection.class, name = "Intersection"),
    @JsonSubTypes.Type(value = Complement.class, name = "Complement"),
    @JsonSubTypes.Type(value = SimpleProtocol.class, name = "SimpleProtocol")
})
public interface NodeMixin {
}
