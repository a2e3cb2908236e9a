package com.spocparser.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.spocparser.ast.*;
import com.spocparser.jackson.mixins.NodeMixin;

/**
 * Jackson module for the policy AST.
 *
 * Registers the polymorphic "type" handling on every node interface and
 * writes IP prefixes as plain strings.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.spocparser", "spoc-jackson"));
        addSerializer(IpPrefix.class, new IpPrefixSerializer());
        addDeserializer(IpPrefix.class, new IpPrefixDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Toplevel.class, NodeMixin.class);
        context.setMixInAnnotations(Element.class, NodeMixin.class);
        context.setMixInAnnotations(AutoGroup.class, NodeMixin.class);
        context.setMixInAnnotations(Protocol.class, NodeMixin.class);
    }
}
