package com.forcetree.ast;

import java.util.List;

/**
 * A local variable, loop variable, catch variable or when-type binding.
 */
public final class VariableDeclaration extends Declaration {

    private final TypeRef type;
    private final Expression initializer;

    public VariableDeclaration(
        Identifier id,
        List<Modifier> modifiers,
        TypeRef type,
        Expression initializer,  // Can be null
        SourceLocation loc
    ) {
        super(id, modifiers, loc);
        this.type = type;
        this.initializer = initializer;
    }

    public TypeRef type() {
        return type;
    }

    public Expression initializer() {
        return initializer;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(type, initializer);
    }
}
