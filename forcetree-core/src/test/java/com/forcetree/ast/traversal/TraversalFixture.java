package com.forcetree.ast.traversal;

import com.forcetree.ast.BreakStatement;
import com.forcetree.ast.CompoundStatement;
import com.forcetree.ast.ContinueStatement;
import com.forcetree.ast.Node;
import com.forcetree.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * The tree R[A[C], B[D]] built from real statements.
 */
final class TraversalFixture {

    final Node c = new BreakStatement(null);
    final Node d = new ContinueStatement(null);
    final CompoundStatement a = block(c);
    final CompoundStatement b = block(d);
    final CompoundStatement r = block(a, b);

    private static CompoundStatement block(Node... statements) {
        List<Statement> list = new ArrayList<>();
        for (Node statement : statements) {
            list.add((Statement) statement);
        }
        return new CompoundStatement(list, CompoundStatement.Scoping.SCOPE_BOUNDARY, null);
    }

    /**
     * Names a node of the fixture for readable assertions.
     */
    String name(Node node) {
        if (node == r) {
            return "R";
        } else if (node == a) {
            return "A";
        } else if (node == b) {
            return "B";
        } else if (node == c) {
            return "C";
        } else if (node == d) {
            return "D";
        }
        return "?";
    }
}
