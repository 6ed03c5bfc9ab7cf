package com.forcetree.ast;

import java.util.List;

/**
 * A property with optional accessors. Accessors are modeled as methods: the getter returns the
 * property type and the setter takes a single parameter named {@code value}.
 */
public final class PropertyDeclaration extends Declaration {

    private final TypeRef type;
    private final MethodDeclaration getter;
    private final MethodDeclaration setter;

    public PropertyDeclaration(
        Identifier id,
        List<Modifier> modifiers,
        TypeRef type,
        MethodDeclaration getter,  // Can be null
        MethodDeclaration setter,  // Can be null
        SourceLocation loc
    ) {
        super(id, modifiers, loc);
        this.type = type;
        this.getter = getter;
        this.setter = setter;
    }

    public TypeRef type() {
        return type;
    }

    public MethodDeclaration getter() {
        return getter;
    }

    public MethodDeclaration setter() {
        return setter;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(type, getter, setter);
    }
}
