package com.forcetree.ast;

import java.util.List;

public final class IfStatement extends Statement {

    private final Expression condition;
    private final Statement thenStatement;
    private final Statement elseStatement;

    public IfStatement(
        Expression condition,
        Statement thenStatement,
        Statement elseStatement,  // Can be null
        SourceLocation loc
    ) {
        super(loc);
        this.condition = condition;
        this.thenStatement = thenStatement;
        this.elseStatement = elseStatement;
    }

    public Expression condition() {
        return condition;
    }

    public Statement thenStatement() {
        return thenStatement;
    }

    public Statement elseStatement() {
        return elseStatement;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(condition, thenStatement, elseStatement);
    }
}
