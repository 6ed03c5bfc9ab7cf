package com.forcetree.ast;

import java.util.List;

public final class ContinueStatement extends Statement {

    public ContinueStatement(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
