package com.forcetree.ast;

/**
 * The part of a {@code new} expression after the type: constructor arguments, element values,
 * map entries or an array size.
 */
public abstract sealed class Initializer extends Node permits
    ConstructorInitializer,
    ValuesInitializer,
    MapInitializer,
    SizedArrayInitializer {

    private final TypeRef type;

    protected Initializer(TypeRef type, SourceLocation loc) {
        super(loc);
        this.type = type;
    }

    /**
     * The type being created. For arrays this includes the array nesting.
     */
    public TypeRef type() {
        return type;
    }
}
