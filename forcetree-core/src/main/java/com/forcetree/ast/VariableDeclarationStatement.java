package com.forcetree.ast;

import java.util.List;

/**
 * A local declaration statement. {@code Integer a = 1, b;} holds two declarations.
 */
public final class VariableDeclarationStatement extends Statement {

    private final List<VariableDeclaration> variableDeclarations;

    public VariableDeclarationStatement(List<VariableDeclaration> variableDeclarations, SourceLocation loc) {
        super(loc);
        this.variableDeclarations = variableDeclarations != null ? List.copyOf(variableDeclarations) : List.of();
    }

    public List<VariableDeclaration> variableDeclarations() {
        return variableDeclarations;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(variableDeclarations);
    }
}
