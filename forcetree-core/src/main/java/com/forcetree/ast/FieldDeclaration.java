package com.forcetree.ast;

import java.util.List;

public final class FieldDeclaration extends Declaration {

    private final TypeRef type;
    private final Expression initializer;

    public FieldDeclaration(
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
