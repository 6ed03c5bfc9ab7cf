package com.forcetree.ast;

import java.util.List;

public final class SuperExpression extends Expression {

    public SuperExpression(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
