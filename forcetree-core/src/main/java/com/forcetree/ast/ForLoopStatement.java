package com.forcetree.ast;

import java.util.List;

/**
 * A classic {@code for (init; condition; update)} loop. The init part either declares
 * variables or evaluates expressions.
 */
public final class ForLoopStatement extends Statement {

    private final List<VariableDeclaration> declarations;
    private final List<Expression> initializations;
    private final Expression condition;
    private final List<Expression> updates;
    private final Statement body;

    public ForLoopStatement(
        List<VariableDeclaration> declarations,
        List<Expression> initializations,
        Expression condition,  // Can be null
        List<Expression> updates,
        Statement body,
        SourceLocation loc
    ) {
        super(loc);
        this.declarations = declarations != null ? List.copyOf(declarations) : List.of();
        this.initializations = initializations != null ? List.copyOf(initializations) : List.of();
        this.condition = condition;
        this.updates = updates != null ? List.copyOf(updates) : List.of();
        this.body = body;
    }

    public List<VariableDeclaration> declarations() {
        return declarations;
    }

    public List<Expression> initializations() {
        return initializations;
    }

    public Expression condition() {
        return condition;
    }

    public List<Expression> updates() {
        return updates;
    }

    public Statement body() {
        return body;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(declarations, initializations, condition, updates, body);
    }
}
