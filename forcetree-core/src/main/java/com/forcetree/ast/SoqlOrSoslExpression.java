package com.forcetree.ast;

import java.util.List;

/**
 * An embedded SOQL or SOSL query. Only the query text and the bound host expressions
 * ({@code :expr}) are modeled.
 */
public final class SoqlOrSoslExpression extends Expression {

    public enum Kind {
        SOQL,
        SOSL
    }

    private final Kind kind;
    private final String query;
    private final List<Expression> bindings;

    public SoqlOrSoslExpression(Kind kind, String query, List<Expression> bindings, SourceLocation loc) {
        super(loc);
        this.kind = kind;
        this.query = query;
        this.bindings = bindings != null ? List.copyOf(bindings) : List.of();
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The query text between the brackets, exactly as written.
     */
    public String query() {
        return query;
    }

    public List<Expression> bindings() {
        return bindings;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(bindings);
    }
}
