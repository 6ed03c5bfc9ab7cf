package com.forcetree.ast;

import java.util.List;

/**
 * A type used as a value, as in {@code Account.class} or the right side of {@code instanceof}.
 */
public final class TypeRefExpression extends Expression {

    private final TypeRef type;

    public TypeRefExpression(TypeRef type, SourceLocation loc) {
        super(loc);
        this.type = type;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(type);
    }
}
