package com.forcetree.ast;

import java.util.List;

public final class FieldExpression extends Expression {

    private final Expression obj;
    private final Identifier id;
    private final boolean safe;

    public FieldExpression(Expression obj, Identifier id, boolean safe, SourceLocation loc) {
        super(loc);
        this.obj = obj;
        this.id = id;
        this.safe = safe;
    }

    public Expression obj() {
        return obj;
    }

    public Identifier id() {
        return id;
    }

    public boolean isSafe() {
        return safe;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(obj, id);
    }
}
