package com.forcetree.ast;

import java.util.List;

/**
 * A name as written in source. Apex names are case-insensitive, but the original spelling is kept.
 */
public final class Identifier extends Node {

    private final String string;

    public Identifier(String string, SourceLocation loc) {
        super(loc);
        this.string = string;
    }

    public String string() {
        return string;
    }

    /**
     * Compares names the way Apex does, ignoring case.
     */
    public boolean matches(String name) {
        return string.equalsIgnoreCase(name);
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }

    @Override
    public String toString() {
        return string;
    }
}
