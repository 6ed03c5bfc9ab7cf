package com.forcetree.ast;

import java.util.List;

public final class ThrowStatement extends Statement {

    private final Expression exception;

    public ThrowStatement(Expression exception, SourceLocation loc) {
        super(loc);
        this.exception = exception;
    }

    public Expression exception() {
        return exception;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(exception);
    }
}
