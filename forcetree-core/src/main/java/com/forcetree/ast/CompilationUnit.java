package com.forcetree.ast;

import java.util.List;

/**
 * Root of a translated file. Holds exactly one top-level type or trigger.
 */
public final class CompilationUnit extends Node {

    private final TypeDeclaration typeDeclaration;
    private final String file;

    public CompilationUnit(TypeDeclaration typeDeclaration, String file, SourceLocation loc) {
        super(loc);
        this.typeDeclaration = typeDeclaration;
        this.file = file;
    }

    public TypeDeclaration typeDeclaration() {
        return typeDeclaration;
    }

    public String file() {
        return file;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(typeDeclaration);
    }
}
