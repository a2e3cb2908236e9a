package com.spocparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.spocparser.ast.IpPrefix;

import java.io.IOException;

public class IpPrefixDeserializer extends JsonDeserializer<IpPrefix> {
    @Override
    public IpPrefix deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (IpPrefix) ctxt.handleUnexpectedToken(IpPrefix.class, p);
        }
        String text = p.getText();
        try {
            return IpPrefix.parse(text);
        } catch (IllegalArgumentException e) {
            return (IpPrefix) ctxt.handleWeirdStringValue(IpPrefix.class, text, e.getMessage());
        }
    }
}
