package com.forcetree.ast;

import java.util.List;

/**
 * {@code System.runAs(user) { ... }}.
 */
public final class RunAsStatement extends Statement {

    private final List<Expression> contexts;
    private final CompoundStatement body;

    public RunAsStatement(List<Expression> contexts, CompoundStatement body, SourceLocation loc) {
        super(loc);
        this.contexts = contexts != null ? List.copyOf(contexts) : List.of();
        this.body = body;
    }

    public List<Expression> contexts() {
        return contexts;
    }

    public CompoundStatement body() {
        return body;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(contexts, body);
    }
}
