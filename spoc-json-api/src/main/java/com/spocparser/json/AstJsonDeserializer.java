package com.spocparser.json;

import com.spocparser.ast.Node;
import com.spocparser.ast.Toplevel;

import java.util.List;

/**
 * Reads AST nodes from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a JSON array of definitions, as written by
     * {@link AstJsonSerializer#serializeToplevels}.
     *
     * @throws AstJsonException if the JSON is malformed or names an unknown node type
     */
    List<Toplevel> deserializeToplevels(String json) throws AstJsonException;

    /**
     * Reads a single node of the expected type.
     *
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
