package com.forcetree.ast;

import java.util.List;

public final class TernaryExpression extends Expression {

    private final Expression condition;
    private final Expression thenValue;
    private final Expression elseValue;

    public TernaryExpression(Expression condition, Expression thenValue, Expression elseValue, SourceLocation loc) {
        super(loc);
        this.condition = condition;
        this.thenValue = thenValue;
        this.elseValue = elseValue;
    }

    public Expression condition() {
        return condition;
    }

    public Expression thenValue() {
        return thenValue;
    }

    public Expression elseValue() {
        return elseValue;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(condition, thenValue, elseValue);
    }
}
