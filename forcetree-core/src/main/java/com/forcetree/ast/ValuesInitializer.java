package com.forcetree.ast;

import java.util.List;

/**
 * Element values for a list, set or array, as in {@code new List<Integer>{1, 2}}.
 */
public final class ValuesInitializer extends Initializer {

    private final List<Expression> values;

    public ValuesInitializer(List<Expression> values, TypeRef type, SourceLocation loc) {
        super(type, loc);
        this.values = values != null ? List.copyOf(values) : List.of();
    }

    public List<Expression> values() {
        return values;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(type(), values);
    }
}
