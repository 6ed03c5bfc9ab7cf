package com.forcetree.translation;

import com.forcetree.ast.SourceLocation;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Per-translation state: the file name, the token stream for location lookups and the node counter.
 */
public class TranslationContext {

    private final String file;
    private final TokenStream tokens;
    private final NodeCounter counter = new NodeCounter();

    public TranslationContext(String file, TokenStream tokens) {
        this.file = file;
        this.tokens = tokens;
    }

    public String file() {
        return file;
    }

    public NodeCounter counter() {
        return counter;
    }

    public SourceLocation locationOf(ParserRuleContext ctx) {
        return locationOf(ctx.getSourceInterval());
    }

    public SourceLocation locationOf(TerminalNode node) {
        return locationOf(node.getSourceInterval());
    }

    /**
     * The location starts at the first token and ends at the start of the token following the
     * last one, or at the last token itself at the end of input.
     */
    private SourceLocation locationOf(Interval interval) {
        if (interval.a < 0 || tokens.size() == 0) {
            return SourceLocation.UNKNOWN;
        }
        int last = tokens.size() - 1;
        Token start = tokens.get(Math.min(interval.a, last));
        Token end = tokens.get(Math.min(Math.max(interval.b + 1, interval.a), last));
        return new SourceLocation(
            start.getLine(), start.getCharPositionInLine(),
            end.getLine(), end.getCharPositionInLine());
    }
}
