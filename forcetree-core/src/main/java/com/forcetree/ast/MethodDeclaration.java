package com.forcetree.ast;

import java.util.List;

/**
 * A method, constructor, property accessor or anonymous initializer block.
 */
public final class MethodDeclaration extends Declaration {

    /** Name given to anonymous initializer blocks. */
    public static final String ANONYMOUS_INITIALIZER_NAME = "_init";

    private final TypeRef returnType;
    private final List<ParameterDeclaration> parameterDeclarations;
    private final CompoundStatement body;
    private final boolean constructor;

    public MethodDeclaration(
        Identifier id,
        List<Modifier> modifiers,
        TypeRef returnType,
        List<ParameterDeclaration> parameterDeclarations,
        CompoundStatement body,  // Can be null
        boolean constructor,
        SourceLocation loc
    ) {
        super(id, modifiers, loc);
        this.returnType = returnType;
        this.parameterDeclarations = parameterDeclarations != null ? List.copyOf(parameterDeclarations) : List.of();
        this.body = body;
        this.constructor = constructor;
    }

    public TypeRef returnType() {
        return returnType;
    }

    public List<ParameterDeclaration> parameterDeclarations() {
        return parameterDeclarations;
    }

    public CompoundStatement body() {
        return body;
    }

    public boolean isConstructor() {
        return constructor;
    }

    public boolean isAnonymousInitializationCode() {
        return ANONYMOUS_INITIALIZER_NAME.equals(id().string());
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(returnType, parameterDeclarations, body);
    }
}
