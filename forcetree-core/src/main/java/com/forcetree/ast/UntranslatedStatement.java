package com.forcetree.ast;

import java.util.List;

public final class UntranslatedStatement extends Statement implements Untranslated {

    public UntranslatedStatement(SourceLocation loc) {
        super(loc);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }
}
