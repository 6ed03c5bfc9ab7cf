package com.forcetree.json;

import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.Node;

/**
 * Reads AST nodes from JSON written by an {@link AstJsonSerializer}. Parent links are restored
 * on the returned tree.
 */
public interface AstJsonDeserializer {

    /**
     * @param json the output of {@link AstJsonSerializer#serialize(Node)} for a whole file
     * @return the rebuilt compilation unit, with parents linked
     * @throws AstJsonException if the JSON is malformed or does not describe a compilation unit
     */
    CompilationUnit deserializeCompilationUnit(String json) throws AstJsonException;

    /**
     * Reads a subtree of a known node type, such as a single statement.
     *
     * @param json the serialized subtree
     * @param type the expected node class or one of its sealed supertypes
     * @return the rebuilt subtree, with parents linked below it
     * @throws AstJsonException if deserialization fails; {@link AstJsonException#getNodeType()}
     *     is {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
