package com.forcetree.ast;

import java.util.List;

public final class UnaryExpression extends Expression {

    public enum Operator {
        PLUS("+", false),
        NEGATION("-", false),
        PRE_INCREMENT("++", false),
        POST_INCREMENT("++", true),
        PRE_DECREMENT("--", false),
        POST_DECREMENT("--", true),
        LOGICAL_COMPLEMENT("!", false),
        BITWISE_NOT("~", false);

        private final String symbol;
        private final boolean postfix;

        Operator(String symbol, boolean postfix) {
            this.symbol = symbol;
            this.postfix = postfix;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return postfix;
        }

        /**
         * Looks up an operator by symbol and position. {@code ++} and {@code --} need the
         * position to tell pre- from post-operations.
         *
         * @throws IllegalArgumentException if no operator matches
         */
        public static Operator fromSymbol(String symbol, boolean postfix) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol) && op.postfix == postfix) {
                    return op;
                }
            }
            throw new IllegalArgumentException(
                "Unknown " + (postfix ? "postfix" : "prefix") + " operator '" + symbol + "'");
        }
    }

    private final Expression operand;
    private final Operator op;

    public UnaryExpression(Expression operand, Operator op, SourceLocation loc) {
        super(loc);
        this.operand = operand;
        this.op = op;
    }

    public Expression operand() {
        return operand;
    }

    public Operator op() {
        return op;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(operand);
    }
}
