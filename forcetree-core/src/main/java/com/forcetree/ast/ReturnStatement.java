package com.forcetree.ast;

import java.util.List;

public final class ReturnStatement extends Statement {

    private final Expression value;

    public ReturnStatement(
        Expression value,  // Can be null
        SourceLocation loc
    ) {
        super(loc);
        this.value = value;
    }

    public Expression value() {
        return value;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(value);
    }
}
