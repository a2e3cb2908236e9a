package com.spocparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.spocparser.ast.IpPrefix;

import java.io.IOException;

/**
 * Writes an IP prefix as the string it is printed as, e.g. "10.1.0.0/16".
 */
public class IpPrefixSerializer extends JsonSerializer<IpPrefix> {
    @Override
    public void serialize(IpPrefix value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(value.toString());
    }
}
