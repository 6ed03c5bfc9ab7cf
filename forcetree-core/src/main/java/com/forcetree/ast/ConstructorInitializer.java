package com.forcetree.ast;

import java.util.List;

public final class ConstructorInitializer extends Initializer {

    private final List<Expression> args;

    public ConstructorInitializer(List<Expression> args, TypeRef type, SourceLocation loc) {
        super(type, loc);
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    public List<Expression> args() {
        return args;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(type(), args);
    }
}
