package com.forcetree.ast;

import java.util.List;

public final class WhileLoopStatement extends Statement {

    private final Expression condition;
    private final Statement body;

    public WhileLoopStatement(Expression condition, Statement body, SourceLocation loc) {
        super(loc);
        this.condition = condition;
        this.body = body;
    }

    public Expression condition() {
        return condition;
    }

    public Statement body() {
        return body;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(condition, body);
    }
}
