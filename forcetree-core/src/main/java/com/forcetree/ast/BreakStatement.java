package com.forcetree.ast;

import java.util.List;

public final class BreakStatement extends Statement {

    public BreakStatement(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
