package com.forcetree.ast;

import java.util.List;

public final class UntranslatedExpression extends Expression implements Untranslated {

    public UntranslatedExpression(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
