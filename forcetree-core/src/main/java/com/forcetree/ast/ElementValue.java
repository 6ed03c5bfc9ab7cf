package com.forcetree.ast;

import java.util.List;

/**
 * The value of an annotation argument.
 */
public abstract sealed class ElementValue extends Node permits
    ElementValue.ExpressionValue,
    ElementValue.AnnotationValue,
    ElementValue.ArrayValue {

    protected ElementValue(SourceLocation loc) {
        super(loc);
    }

    public static final class ExpressionValue extends ElementValue {
        private final Expression value;

        public ExpressionValue(Expression value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        public Expression value() {
            return value;
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(value);
        }
    }

    public static final class AnnotationValue extends ElementValue {
        private final AnnotationModifier value;

        public AnnotationValue(AnnotationModifier value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        public AnnotationModifier value() {
            return value;
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(value);
        }
    }

    public static final class ArrayValue extends ElementValue {
        private final List<ElementValue> values;

        public ArrayValue(List<ElementValue> values, SourceLocation loc) {
            super(loc);
            this.values = values != null ? List.copyOf(values) : List.of();
        }

        public List<ElementValue> values() {
            return values;
        }

        @Override
        protected List<Node> childNodes() {
            return listOf(values);
        }
    }
}
