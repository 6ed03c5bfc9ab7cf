package com.forcetree.ast;

import java.util.List;
import java.util.Locale;

public final class BinaryExpression extends Expression {

    public enum Operator {
        ADDITION("+"),
        SUBTRACTION("-"),
        MULTIPLICATION("*"),
        DIVISION("/"),
        MODULO("%"),
        LEFT_SHIFT("<<"),
        RIGHT_SHIFT_SIGNED(">>"),
        RIGHT_SHIFT_UNSIGNED(">>>"),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        ALTERNATIVE_NOT_EQUAL("<>"),
        EXACTLY_EQUAL("==="),
        EXACTLY_NOT_EQUAL("!=="),
        BITWISE_AND("&"),
        BITWISE_OR("|"),
        BITWISE_XOR("^"),
        LOGICAL_AND("&&"),
        LOGICAL_OR("||"),
        INSTANCEOF("instanceof");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * @throws IllegalArgumentException if the symbol is not a binary operator
         */
        public static Operator fromSymbol(String symbol) {
            String normalized = symbol.toLowerCase(Locale.ROOT);
            for (Operator op : values()) {
                if (op.symbol.equals(normalized)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown operator '" + symbol + "'");
        }
    }

    private final Expression left;
    private final Operator op;
    private final Expression right;

    public BinaryExpression(Expression left, Operator op, Expression right, SourceLocation loc) {
        super(loc);
        this.left = left;
        this.op = op;
        this.right = right;
    }

    public Expression left() {
        return left;
    }

    public Operator op() {
        return op;
    }

    public Expression right() {
        return right;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(left, right);
    }
}
