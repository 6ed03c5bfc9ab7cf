package com.forcetree.ast;

/**
 * A keyword or annotation attached to a declaration.
 */
public abstract sealed class Modifier extends Node permits KeywordModifier, AnnotationModifier {

    protected Modifier(SourceLocation loc) {
        super(loc);
    }
}
