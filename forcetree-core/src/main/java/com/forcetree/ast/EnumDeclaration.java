package com.forcetree.ast;

import java.util.List;

public final class EnumDeclaration extends TypeDeclaration {

    private final List<Identifier> values;

    public EnumDeclaration(Identifier id, List<Modifier> modifiers, List<Identifier> values, SourceLocation loc) {
        super(id, modifiers, loc);
        this.values = values != null ? List.copyOf(values) : List.of();
    }

    /**
     * The enum constants in declaration order.
     */
    public List<Identifier> values() {
        return values;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(values);
    }
}
