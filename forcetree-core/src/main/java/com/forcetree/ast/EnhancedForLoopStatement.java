package com.forcetree.ast;

import java.util.List;

public final class EnhancedForLoopStatement extends Statement {

    private final VariableDeclaration elementDeclaration;
    private final Expression collection;
    private final Statement body;

    public EnhancedForLoopStatement(
        VariableDeclaration elementDeclaration,
        Expression collection,
        Statement body,
        SourceLocation loc
    ) {
        super(loc);
        this.elementDeclaration = elementDeclaration;
        this.collection = collection;
        this.body = body;
    }

    public VariableDeclaration elementDeclaration() {
        return elementDeclaration;
    }

    public Expression collection() {
        return collection;
    }

    public Statement body() {
        return body;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(elementDeclaration, collection, body);
    }
}
