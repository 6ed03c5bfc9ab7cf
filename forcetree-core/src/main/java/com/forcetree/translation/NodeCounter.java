package com.forcetree.translation;

import com.forcetree.ast.Node;

/**
 * Counts the nodes created during one translation.
 */
public class NodeCounter {

    private int count;

    public <T extends Node> T register(T node) {
        count++;
        return node;
    }

    public int count() {
        return count;
    }
}
