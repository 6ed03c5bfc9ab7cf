package com.forcetree.json;

import com.forcetree.ast.Node;

/**
 * Thrown when an Apex AST cannot be written as JSON or rebuilt from it.
 *
 * <p>When the failure concerns a particular node class, such as the type requested from
 * {@link AstJsonDeserializer#deserialize(String, Class)}, it is available from
 * {@link #getNodeType()}.</p>
 */
public class AstJsonException extends RuntimeException {

    private final Class<? extends Node> nodeType;

    /**
     * @param message what went wrong
     */
    public AstJsonException(String message) {
        this(null, message, null);
    }

    /**
     * @param message what went wrong
     * @param cause the binding's own exception
     */
    public AstJsonException(String message, Throwable cause) {
        this(null, message, cause);
    }

    /**
     * @param nodeType the node class being written or read, or null if unknown
     * @param message what went wrong
     * @param cause the binding's own exception, or null
     */
    public AstJsonException(Class<? extends Node> nodeType, String message, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /**
     * @return the node class involved, or null if the failure is not tied to one
     */
    public Class<? extends Node> getNodeType() {
        return nodeType;
    }
}
