package com.forcetree.ast;

import java.util.List;

public final class CastExpression extends Expression {

    private final Expression value;
    private final TypeRef type;

    public CastExpression(Expression value, TypeRef type, SourceLocation loc) {
        super(loc);
        this.value = value;
        this.type = type;
    }

    public Expression value() {
        return value;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(type, value);
    }
}
