package com.forcetree.ast;

import java.util.List;

/**
 * A name and value pair inside an annotation.
 */
public final class ElementArgument extends Node {

    /** Name reported for an argument written without one. */
    public static final String IMPLICIT_NAME = "value";

    private final Identifier name;
    private final ElementValue value;

    public ElementArgument(
        Identifier name,  // Null when the argument is written without a name
        ElementValue value,
        SourceLocation loc
    ) {
        super(loc);
        this.name = name;
        this.value = value;
    }

    public Identifier name() {
        return name;
    }

    public ElementValue value() {
        return value;
    }

    public boolean isNameImplicit() {
        return name == null;
    }

    public String nameString() {
        return name != null ? name.string() : IMPLICIT_NAME;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(name, value);
    }
}
