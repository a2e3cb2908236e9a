package com.spocparser.jackson;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for the policy AST.
 *
 * <pre>
 * ObjectMapper mapper = SpocJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(group);
 * Group group = mapper.readValue(json, Group.class);
 * </pre>
 */
public final class SpocJackson {

    private SpocJackson() {
        // Utility class
    }

    /**
     * The returned mapper writes every node with a "type" property, leaves
     * out null fields (a missing description, log or extension) and
     * ignores unknown properties when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Only record components are properties; isList() is derived.
        mapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
