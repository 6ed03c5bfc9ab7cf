package com.forcetree.ast;

import java.util.List;

public final class InterfaceDeclaration extends TypeDeclaration {

    private final List<TypeRef> extendsTypes;
    private final List<MethodDeclaration> methodDeclarations;

    public InterfaceDeclaration(
        Identifier id,
        List<Modifier> modifiers,
        List<TypeRef> extendsTypes,
        List<MethodDeclaration> methodDeclarations,
        SourceLocation loc
    ) {
        super(id, modifiers, loc);
        this.extendsTypes = extendsTypes != null ? List.copyOf(extendsTypes) : List.of();
        this.methodDeclarations = methodDeclarations != null ? List.copyOf(methodDeclarations) : List.of();
    }

    public List<TypeRef> extendsTypes() {
        return extendsTypes;
    }

    public List<MethodDeclaration> methodDeclarations() {
        return methodDeclarations;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(extendsTypes, methodDeclarations);
    }
}
