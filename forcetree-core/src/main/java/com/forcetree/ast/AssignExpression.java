package com.forcetree.ast;

import java.util.List;

/**
 * An assignment. A compound assignment such as {@code x += 1} records its operation in
 * {@link #preOperation()}; a plain assignment has none.
 */
public final class AssignExpression extends Expression {

    private final Expression target;
    private final Expression value;
    private final BinaryExpression.Operator preOperation;

    public AssignExpression(
        Expression target,
        Expression value,
        BinaryExpression.Operator preOperation,  // Can be null
        SourceLocation loc
    ) {
        super(loc);
        this.target = target;
        this.value = value;
        this.preOperation = preOperation;
    }

    public Expression target() {
        return target;
    }

    public Expression value() {
        return value;
    }

    public BinaryExpression.Operator preOperation() {
        return preOperation;
    }

    /**
     * Maps an assignment token such as {@code <<=} to its operation, or null for {@code =}.
     *
     * @throws IllegalArgumentException if the token is not an assignment
     */
    public static BinaryExpression.Operator preOperationFromSymbol(String symbol) {
        if ("=".equals(symbol)) {
            return null;
        }
        if (symbol.length() < 2 || !symbol.endsWith("=")) {
            throw new IllegalArgumentException("Unknown assignment '" + symbol + "'");
        }
        return BinaryExpression.Operator.fromSymbol(symbol.substring(0, symbol.length() - 1));
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(target, value);
    }
}
