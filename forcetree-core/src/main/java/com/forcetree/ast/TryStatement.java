package com.forcetree.ast;

import java.util.List;

public final class TryStatement extends Statement {

    /**
     * A {@code catch} clause. The caught exception is bound as a variable declaration.
     */
    public static final class CatchBlock extends Node {
        private final VariableDeclaration exceptionVariable;
        private final CompoundStatement body;

        public CatchBlock(VariableDeclaration exceptionVariable, CompoundStatement body, SourceLocation loc) {
            super(loc);
            this.exceptionVariable = exceptionVariable;
            this.body = body;
        }

        public VariableDeclaration exceptionVariable() {
            return exceptionVariable;
        }

        public CompoundStatement body() {
            return body;
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(exceptionVariable, body);
        }
    }

    private final CompoundStatement body;
    private final List<CatchBlock> catchBlocks;
    private final CompoundStatement finallyBlock;

    public TryStatement(
        CompoundStatement body,
        List<CatchBlock> catchBlocks,
        CompoundStatement finallyBlock,  // Can be null
        SourceLocation loc
    ) {
        super(loc);
        this.body = body;
        this.catchBlocks = catchBlocks != null ? List.copyOf(catchBlocks) : List.of();
        this.finallyBlock = finallyBlock;
    }

    public CompoundStatement body() {
        return body;
    }

    public List<CatchBlock> catchBlocks() {
        return catchBlocks;
    }

    public CompoundStatement finallyBlock() {
        return finallyBlock;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(body, catchBlocks, finallyBlock);
    }
}
