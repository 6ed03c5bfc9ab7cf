package com.forcetree;

import java.util.List;

/**
 * Thrown when source text cannot be parsed or translated.
 */
public class ParseException extends Exception {

    private final List<String> syntaxErrors;

    public ParseException(String message, List<String> syntaxErrors) {
        super(message);
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.syntaxErrors = List.of();
    }

    /**
     * Syntax errors reported by the lexer and parser, empty when translation failed instead.
     */
    public List<String> getSyntaxErrors() {
        return syntaxErrors;
    }
}
