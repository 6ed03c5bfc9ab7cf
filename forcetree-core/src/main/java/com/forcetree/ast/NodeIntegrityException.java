package com.forcetree.ast;

/**
 * Thrown when the tree structure is violated, for example when a node is given a second parent.
 */
public class NodeIntegrityException extends RuntimeException {

    public NodeIntegrityException(String message) {
        super(message);
    }
}
