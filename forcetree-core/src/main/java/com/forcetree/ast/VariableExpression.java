package com.forcetree.ast;

import java.util.List;

/**
 * A bare name. It may refer to a local, a field, a type or an enum value.
 */
public final class VariableExpression extends Expression {

    private final Identifier id;

    public VariableExpression(Identifier id, SourceLocation loc) {
        super(loc);
        this.id = id;
    }

    public Identifier id() {
        return id;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(id);
    }
}
