package com.forcetree.ast;

import java.util.List;

public final class MapInitializer extends Initializer {

    /**
     * One {@code key => value} pair.
     */
    public static final class Entry extends Node {
        private final Expression key;
        private final Expression value;

        public Entry(Expression key, Expression value, SourceLocation loc) {
            super(loc);
            this.key = key;
            this.value = value;
        }

        public Expression key() {
            return key;
        }

        public Expression value() {
            return value;
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(key, value);
        }
    }

    private final List<Entry> pairs;

    public MapInitializer(List<Entry> pairs, TypeRef type, SourceLocation loc) {
        super(type, loc);
        this.pairs = pairs != null ? List.copyOf(pairs) : List.of();
    }

    public List<Entry> pairs() {
        return pairs;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(type(), pairs);
    }
}
