package com.forcetree.json;

import com.forcetree.ast.Node;

/**
 * Writes AST nodes as JSON. Each node carries an {@code @type} property naming its class.
 * Parent links are never written.
 */
public interface AstJsonSerializer {

    /**
     * @param node the root of the subtree to write, usually a {@code CompilationUnit}
     * @return the JSON text on a single line
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Like {@link #serialize(Node)}, indented for reading.
     *
     * @param node the root of the subtree to write
     * @return the indented JSON text
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
