package com.forcetree.ast;

import java.util.List;

/**
 * A sequence of statements.
 */
public final class CompoundStatement extends Statement {

    public enum Scoping {
        /** A braced block that opens a new variable scope. */
        SCOPE_BOUNDARY,
        /** A grouping that introduces no scope, such as several declarations from one line. */
        TRANSPARENT
    }

    private final List<Statement> statements;
    private final Scoping scoping;

    public CompoundStatement(List<Statement> statements, Scoping scoping, SourceLocation loc) {
        super(loc);
        this.statements = statements != null ? List.copyOf(statements) : List.of();
        this.scoping = scoping;
    }

    public List<Statement> statements() {
        return statements;
    }

    public Scoping scoping() {
        return scoping;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(statements);
    }
}
