package com.forcetree.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named declaration with modifiers.
 */
public abstract sealed class Declaration extends Node permits
    TypeDeclaration,
    MethodDeclaration,
    FieldDeclaration,
    PropertyDeclaration,
    ParameterDeclaration,
    VariableDeclaration {

    private final Identifier id;
    private final List<Modifier> modifiers;

    protected Declaration(Identifier id, List<Modifier> modifiers, SourceLocation loc) {
        super(loc);
        this.id = id;
        this.modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    public Identifier id() {
        return id;
    }

    public List<Modifier> modifiers() {
        return modifiers;
    }

    public List<KeywordModifier> keywordModifiers() {
        List<KeywordModifier> result = new ArrayList<>();
        for (Modifier modifier : modifiers) {
            if (modifier instanceof KeywordModifier keyword) {
                result.add(keyword);
            }
        }
        return result;
    }

    public List<AnnotationModifier> annotationModifiers() {
        List<AnnotationModifier> result = new ArrayList<>();
        for (Modifier modifier : modifiers) {
            if (modifier instanceof AnnotationModifier annotation) {
                result.add(annotation);
            }
        }
        return result;
    }

    public boolean hasKeyword(KeywordModifier.Keyword keyword) {
        for (Modifier modifier : modifiers) {
            if (modifier instanceof KeywordModifier k && k.keyword() == keyword) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the annotation with the given name, ignoring case, or null.
     */
    public AnnotationModifier annotation(String name) {
        for (AnnotationModifier annotation : annotationModifiers()) {
            if (annotation.name().matches(name)) {
                return annotation;
            }
        }
        return null;
    }

    /**
     * Returns the nearest enclosing type declaration, or null. Requires linked parents.
     */
    public TypeDeclaration enclosingType() {
        Node node = parent();
        while (node != null) {
            if (node instanceof TypeDeclaration type) {
                return type;
            }
            node = node.parent();
        }
        return null;
    }

    /**
     * Returns the dotted name of this declaration including its enclosing types,
     * for example {@code Outer.Inner.method}. Requires linked parents.
     */
    public String qualifiedName() {
        List<String> parts = new ArrayList<>();
        parts.add(id.string());
        TypeDeclaration type = enclosingType();
        while (type != null) {
            parts.add(type.id().string());
            type = type.enclosingType();
        }
        Collections.reverse(parts);
        return String.join(".", parts);
    }

    /**
     * Modifiers first, then the name, so children stay in source order.
     */
    protected List<Node> declarationChildren(Object... rest) {
        Object[] parts = new Object[rest.length + 2];
        parts[0] = modifiers;
        parts[1] = id;
        System.arraycopy(rest, 0, parts, 2, rest.length);
        return listOf(parts);
    }
}
