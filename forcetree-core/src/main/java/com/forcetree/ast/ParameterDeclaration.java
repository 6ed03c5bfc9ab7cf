package com.forcetree.ast;

import java.util.List;

public final class ParameterDeclaration extends Declaration {

    private final TypeRef type;

    public ParameterDeclaration(Identifier id, List<Modifier> modifiers, TypeRef type, SourceLocation loc) {
        super(id, modifiers, loc);
        this.type = type;
    }

    public TypeRef type() {
        return type;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(type);
    }
}
