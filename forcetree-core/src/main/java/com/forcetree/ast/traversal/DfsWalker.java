package com.forcetree.ast.traversal;

import com.forcetree.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Iterative depth-first walk over an AST.
 *
 * <p>Unlike {@link Node#walkSubtree(Visitor)} the walk is pulled one node at a time, so it can be
 * consumed as a lazy {@link Stream} and abandoned early.
 */
public class DfsWalker implements Supplier<DfsWalker.NodeAndDoneFlag> {

    public enum Ordering {
        /** A parent is returned before all its children. */
        PRE_ORDER,
        /** A parent is returned after all its children. */
        POST_ORDER
    }

    /**
     * A node paired with a flag that is true once the walk is finished. When done, the node is the
     * start node and carries no meaning.
     */
    public record NodeAndDoneFlag(Node node, boolean done) {
    }

    private enum Status {
        /** Children not yet pushed. */
        UNVISITED,
        /** Children pushed; the node is emitted when popped again. */
        IN_PROGRESS
    }

    private record NodeAndStatus(Node node, Status status) {
    }

    private final Node start;
    private final Ordering ordering;
    private final Predicate<Node> skipBelow;
    private final Deque<NodeAndStatus> stack = new ArrayDeque<>();

    public DfsWalker(Node start) {
        this(start, Ordering.POST_ORDER, node -> false);
    }

    public DfsWalker(Node start, Ordering ordering) {
        this(start, ordering, node -> false);
    }

    public DfsWalker(Node start, Ordering ordering, Predicate<Node> skipBelow) {
        this.start = start;
        this.ordering = ordering;
        this.skipBelow = skipBelow;
        stack.push(new NodeAndStatus(start, Status.UNVISITED));
    }

    @Override
    public NodeAndDoneFlag get() {
        while (!stack.isEmpty()) {
            NodeAndStatus element = stack.pop();
            if (ordering == Ordering.PRE_ORDER) {
                pushChildrenUnlessSkipped(element.node());
                return new NodeAndDoneFlag(element.node(), false);
            }
            if (element.status() == Status.IN_PROGRESS) {
                return new NodeAndDoneFlag(element.node(), false);
            }
            stack.push(new NodeAndStatus(element.node(), Status.IN_PROGRESS));
            pushChildrenUnlessSkipped(element.node());
        }
        return new NodeAndDoneFlag(start, true);
    }

    /**
     * Returns the remaining walk as a finite, ordered, sequential stream. The stream shares this
     * walker's state and can be consumed once.
     */
    public Stream<Node> stream() {
        Spliterator<Node> spliterator = new Spliterators.AbstractSpliterator<>(
            Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super Node> action) {
                NodeAndDoneFlag next = get();
                if (next.done()) {
                    return false;
                }
                action.accept(next.node());
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    private void pushChildrenUnlessSkipped(Node parent) {
        if (skipBelow.test(parent)) {
            return;
        }
        List<Node> children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new NodeAndStatus(children.get(i), Status.UNVISITED));
        }
    }
}
