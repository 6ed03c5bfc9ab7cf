package com.forcetree.ast;

import java.util.ArrayList;
import java.util.List;

public final class ClassDeclaration extends TypeDeclaration {

    private final TypeRef extendsType;
    private final List<TypeRef> implementsTypes;
    private final List<Declaration> bodyDeclarations;

    public ClassDeclaration(
        Identifier id,
        List<Modifier> modifiers,
        TypeRef extendsType,  // Can be null
        List<TypeRef> implementsTypes,
        List<Declaration> bodyDeclarations,
        SourceLocation loc
    ) {
        super(id, modifiers, loc);
        this.extendsType = extendsType;
        this.implementsTypes = implementsTypes != null ? List.copyOf(implementsTypes) : List.of();
        this.bodyDeclarations = bodyDeclarations != null ? List.copyOf(bodyDeclarations) : List.of();
    }

    public TypeRef extendsType() {
        return extendsType;
    }

    public List<TypeRef> implementsTypes() {
        return implementsTypes;
    }

    /**
     * All member declarations in source order.
     */
    public List<Declaration> bodyDeclarations() {
        return bodyDeclarations;
    }

    public List<TypeDeclaration> innerTypeDeclarations() {
        return filter(TypeDeclaration.class);
    }

    public List<FieldDeclaration> fieldDeclarations() {
        return filter(FieldDeclaration.class);
    }

    public List<MethodDeclaration> methodDeclarations() {
        return filter(MethodDeclaration.class);
    }

    public List<PropertyDeclaration> propertyDeclarations() {
        return filter(PropertyDeclaration.class);
    }

    private <T extends Declaration> List<T> filter(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Declaration declaration : bodyDeclarations) {
            if (type.isInstance(declaration)) {
                result.add(type.cast(declaration));
            }
        }
        return result;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(extendsType, implementsTypes, bodyDeclarations);
    }
}
