package com.forcetree.ast;

import java.util.List;

public final class ExpressionStatement extends Statement {

    private final Expression expression;

    public ExpressionStatement(Expression expression, SourceLocation loc) {
        super(loc);
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(expression);
    }
}
