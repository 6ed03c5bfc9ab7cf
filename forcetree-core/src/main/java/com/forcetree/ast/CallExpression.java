package com.forcetree.ast;

import java.util.List;

/**
 * A method call. The receiver is null for unqualified calls such as {@code foo()},
 * {@code this(...)} and {@code super(...)}.
 */
public final class CallExpression extends Expression {

    private final Expression receiver;
    private final Identifier id;
    private final List<Expression> args;
    private final boolean safe;

    public CallExpression(
        Expression receiver,  // Can be null
        Identifier id,
        List<Expression> args,
        boolean safe,
        SourceLocation loc
    ) {
        super(loc);
        this.receiver = receiver;
        this.id = id;
        this.args = args != null ? List.copyOf(args) : List.of();
        this.safe = safe;
    }

    public Expression receiver() {
        return receiver;
    }

    public Identifier id() {
        return id;
    }

    public List<Expression> args() {
        return args;
    }

    /**
     * True for a null-safe call written with {@code ?.}.
     */
    public boolean isSafe() {
        return safe;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(receiver, id, args);
    }
}
