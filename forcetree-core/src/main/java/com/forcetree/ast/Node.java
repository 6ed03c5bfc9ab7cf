package com.forcetree.ast;

import com.forcetree.ast.traversal.Visitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Base class for all Apex AST nodes.
 *
 * <p>A node owns its children through final fields. The child list is derived from those
 * fields once and cached. The parent is a non-owning back-reference set by
 * {@link #linkParents(Node)} after the whole tree has been built.
 */
public abstract sealed class Node permits
    CompilationUnit,
    Declaration,
    Expression,
    Statement,
    Modifier,
    Initializer,
    Identifier,
    TypeRef,
    ElementArgument,
    ElementValue,
    SwitchStatement.When,
    TryStatement.CatchBlock,
    MapInitializer.Entry {

    private final SourceLocation loc;
    private transient Node parent;
    private transient List<Node> children;

    protected Node(SourceLocation loc) {
        this.loc = loc != null ? loc : SourceLocation.UNKNOWN;
    }

    public SourceLocation loc() {
        return loc;
    }

    /**
     * Returns the parent of this node, or null for the root or before parents are linked.
     */
    public Node parent() {
        return parent;
    }

    public List<Node> children() {
        List<Node> result = children;
        if (result == null) {
            result = List.copyOf(childNodes());
            children = result;
        }
        return result;
    }

    /**
     * Lists the direct children of this node in source order. Absent optional parts are omitted.
     */
    protected abstract List<Node> childNodes();

    /**
     * Walks the subtree rooted at this node depth-first in post-order.
     *
     * @return false if the walk was halted by {@link Visitor#stopAt(Node)}
     */
    public boolean walkSubtree(Visitor visitor) {
        if (visitor.stopAt(this)) {
            return false;
        }
        if (!visitor.skipBelow(this)) {
            for (Node child : children()) {
                if (!child.walkSubtree(visitor)) {
                    return false;
                }
            }
        }
        visitor.visit(this);
        return true;
    }

    void setParent(Node parent) {
        if (this.parent != null) {
            throw new NodeIntegrityException(
                "Node " + getClass().getSimpleName() + " at " + loc + " already has a parent "
                    + this.parent.getClass().getSimpleName());
        }
        this.parent = parent;
    }

    /**
     * Sets the parent of every node reachable from {@code root}.
     *
     * @return the number of reachable nodes, root included
     * @throws NodeIntegrityException if a node is reachable through two parents
     */
    public static int linkParents(Node root) {
        int count = 0;
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            count++;
            for (Node child : node.children()) {
                child.setParent(node);
                stack.push(child);
            }
        }
        return count;
    }

    /**
     * Flattens nodes and collections of nodes into one list, skipping nulls.
     */
    protected static List<Node> listOf(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element != null) {
                        result.add((Node) element);
                    }
                }
            }
        }
        return result;
    }
}
