package com.forcetree.ast;

import java.util.List;
import java.util.Locale;

public final class KeywordModifier extends Modifier {

    public enum Keyword {
        ABSTRACT,
        FINAL,
        GLOBAL,
        INHERITED_SHARING,
        OVERRIDE,
        PRIVATE,
        PROTECTED,
        PUBLIC,
        STATIC,
        TESTMETHOD,
        TRANSIENT,
        VIRTUAL,
        WEBSERVICE,
        WITH_SHARING,
        WITHOUT_SHARING;

        /**
         * Parses a keyword from source text. Case, whitespace and underscores are ignored,
         * so {@code with  sharing} and {@code WITH_SHARING} are the same keyword.
         *
         * @return the keyword, or null if the text is not a modifier keyword
         */
        public static Keyword fromString(String text) {
            String normalized = squash(text);
            for (Keyword keyword : values()) {
                if (squash(keyword.name()).equals(normalized)) {
                    return keyword;
                }
            }
            return null;
        }

        private static String squash(String text) {
            return text.replaceAll("[\\s_]", "").toUpperCase(Locale.ROOT);
        }
    }

    private final Keyword keyword;

    public KeywordModifier(Keyword keyword, SourceLocation loc) {
        super(loc);
        this.keyword = keyword;
    }

    public Keyword keyword() {
        return keyword;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of();
    }

    @Override
    public String toString() {
        return keyword.name();
    }
}
