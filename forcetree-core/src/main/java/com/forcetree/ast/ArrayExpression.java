package com.forcetree.ast;

import java.util.List;

public final class ArrayExpression extends Expression {

    private final Expression array;
    private final Expression index;

    public ArrayExpression(Expression array, Expression index, SourceLocation loc) {
        super(loc);
        this.array = array;
        this.index = index;
    }

    public Expression array() {
        return array;
    }

    public Expression index() {
        return index;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(array, index);
    }
}
