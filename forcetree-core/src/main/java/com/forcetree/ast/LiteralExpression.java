package com.forcetree.ast;

import java.util.List;

/**
 * A literal constant. Each variant carries the parsed value.
 */
public abstract sealed class LiteralExpression extends Expression permits
    LiteralExpression.IntegerVal,
    LiteralExpression.LongVal,
    LiteralExpression.DoubleVal,
    LiteralExpression.StringVal,
    LiteralExpression.BooleanVal,
    LiteralExpression.NullVal {

    protected LiteralExpression(SourceLocation loc) {
        super(loc);
    }

    /**
     * Returns the parsed value, or null for the null literal.
     */
    public abstract Object value();

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }

    public static final class IntegerVal extends LiteralExpression {
        private final int value;

        public IntegerVal(int value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        @Override
        public Integer value() {
            return value;
        }
    }

    public static final class LongVal extends LiteralExpression {
        private final long value;

        public LongVal(long value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        @Override
        public Long value() {
            return value;
        }
    }

    public static final class DoubleVal extends LiteralExpression {
        private final double value;

        public DoubleVal(double value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        @Override
        public Double value() {
            return value;
        }
    }

    /**
     * A string literal with its quotes removed. Escape sequences are kept as written.
     */
    public static final class StringVal extends LiteralExpression {
        private final String value;

        public StringVal(String value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        @Override
        public String value() {
            return value;
        }
    }

    public static final class BooleanVal extends LiteralExpression {
        private final boolean value;

        public BooleanVal(boolean value, SourceLocation loc) {
            super(loc);
            this.value = value;
        }

        @Override
        public Boolean value() {
            return value;
        }
    }

    public static final class NullVal extends LiteralExpression {
        public NullVal(SourceLocation loc) {
            super(loc);
        }

        @Override
        public Object value() {
            return null;
        }
    }
}
