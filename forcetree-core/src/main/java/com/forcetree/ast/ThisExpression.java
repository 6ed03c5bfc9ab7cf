package com.forcetree.ast;

import java.util.List;

public final class ThisExpression extends Expression {

    public ThisExpression(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
