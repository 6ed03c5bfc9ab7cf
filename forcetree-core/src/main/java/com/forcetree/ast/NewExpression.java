package com.forcetree.ast;

import java.util.List;

public final class NewExpression extends Expression {

    private final Initializer initializer;

    public NewExpression(Initializer initializer, SourceLocation loc) {
        super(loc);
        this.initializer = initializer;
    }

    public Initializer initializer() {
        return initializer;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(initializer);
    }
}
