package com.forcetree.ast;

import java.util.List;

/**
 * A {@code switch on} statement with its {@code when} clauses in source order.
 */
public final class SwitchStatement extends Statement {

    /**
     * One {@code when} clause.
     */
    public abstract static sealed class When extends Node permits WhenValue, WhenType, WhenElse {
        private final Statement statement;

        protected When(Statement statement, SourceLocation loc) {
            super(loc);
            this.statement = statement;
        }

        public Statement statement() {
            return statement;
        }
    }

    /**
     * {@code when 1, 2 { ... }}. Values are literals or enum names.
     */
    public static final class WhenValue extends When {
        private final List<Expression> values;

        public WhenValue(List<Expression> values, Statement statement, SourceLocation loc) {
            super(statement, loc);
            this.values = values != null ? List.copyOf(values) : List.of();
        }

        public List<Expression> values() {
            return values;
        }

        @Override
        protected List<Node> childNodes() {
            return listOf(values, statement());
        }
    }

    /**
     * {@code when Account a { ... }}. The binding is modeled as a variable declaration.
     */
    public static final class WhenType extends When {
        private final TypeRef type;
        private final VariableDeclaration variableDeclaration;

        public WhenType(TypeRef type, VariableDeclaration variableDeclaration, Statement statement, SourceLocation loc) {
            super(statement, loc);
            this.type = type;
            this.variableDeclaration = variableDeclaration;
        }

        public TypeRef type() {
            return type;
        }

        public VariableDeclaration variableDeclaration() {
            return variableDeclaration;
        }

        @Override
        protected List<Node> childNodes() {
            return listOf(type, variableDeclaration, statement());
        }
    }

    public static final class WhenElse extends When {
        public WhenElse(Statement statement, SourceLocation loc) {
            super(statement, loc);
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(statement());
        }
    }

    private final Expression condition;
    private final List<When> whenClauses;

    public SwitchStatement(Expression condition, List<When> whenClauses, SourceLocation loc) {
        super(loc);
        this.condition = condition;
        this.whenClauses = whenClauses != null ? List.copyOf(whenClauses) : List.of();
    }

    public Expression condition() {
        return condition;
    }

    public List<When> whenClauses() {
        return whenClauses;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(condition, whenClauses);
    }
}
