package com.forcetree.ast.traversal;

import com.forcetree.ast.Node;

/**
 * Callback for {@link Node#walkSubtree(Visitor)}.
 *
 * <p>Nodes are visited depth-first in post-order: every child before its parent.
 */
public abstract class Visitor {

    public abstract void visit(Node node);

    /**
     * Returns true to halt the whole walk before this node. Neither the node, its subtree nor any
     * ancestor still waiting on it is visited afterwards.
     */
    public boolean stopAt(Node node) {
        return false;
    }

    /**
     * Returns true to skip the subtree below this node. The node itself is still visited.
     */
    public boolean skipBelow(Node node) {
        return false;
    }
}
