package com.forcetree.ast;

import java.util.List;

/**
 * A class, interface, enum or trigger.
 */
public abstract sealed class TypeDeclaration extends Declaration permits
    ClassDeclaration,
    InterfaceDeclaration,
    EnumDeclaration,
    TriggerDeclaration {

    protected TypeDeclaration(Identifier id, List<Modifier> modifiers, SourceLocation loc) {
        super(id, modifiers, loc);
    }
}
