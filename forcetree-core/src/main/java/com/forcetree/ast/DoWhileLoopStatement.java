package com.forcetree.ast;

import java.util.List;

public final class DoWhileLoopStatement extends Statement {

    private final Statement body;
    private final Expression condition;

    public DoWhileLoopStatement(Statement body, Expression condition, SourceLocation loc) {
        super(loc);
        this.body = body;
        this.condition = condition;
    }

    public Statement body() {
        return body;
    }

    public Expression condition() {
        return condition;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(body, condition);
    }
}
