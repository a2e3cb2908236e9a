package com.spocparser.json;

import com.spocparser.ast.Node;
import com.spocparser.ast.Toplevel;

import java.util.List;

/**
 * Writes AST nodes as JSON.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes the definitions of a file as a JSON array.
     *
     * @param pretty indent the output
     * @throws AstJsonException if serialization fails
     */
    String serializeToplevels(List<? extends Toplevel> toplevels, boolean pretty) throws AstJsonException;
}
