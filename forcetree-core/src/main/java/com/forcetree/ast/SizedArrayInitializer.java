package com.forcetree.ast;

import java.util.List;

public final class SizedArrayInitializer extends Initializer {

    private final Expression size;

    public SizedArrayInitializer(Expression size, TypeRef type, SourceLocation loc) {
        super(type, loc);
        this.size = size;
    }

    public Expression size() {
        return size;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(type(), size);
    }
}
