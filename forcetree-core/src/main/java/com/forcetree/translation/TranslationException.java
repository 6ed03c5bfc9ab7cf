package com.forcetree.translation;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Thrown when a parse tree cannot be translated into an AST. Carries the parse-tree context
 * that failed.
 */
public class TranslationException extends Exception {

    private final transient ParserRuleContext context;

    public TranslationException(ParserRuleContext context, String message) {
        super(message);
        this.context = context;
    }

    public TranslationException(ParserRuleContext context, String message, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    public ParserRuleContext getContext() {
        return context;
    }

    /**
     * Returns the source text of the failing context, or null if there is none.
     */
    public String getContextText() {
        return context != null ? context.getText() : null;
    }
}
