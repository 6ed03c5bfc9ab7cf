package com.forcetree.ast;

import java.util.List;
import java.util.Locale;

/**
 * A trigger on an SObject type. Triggers have no modifiers.
 */
public final class TriggerDeclaration extends TypeDeclaration {

    public enum TriggerCase {
        BEFORE_INSERT,
        BEFORE_UPDATE,
        BEFORE_DELETE,
        BEFORE_UNDELETE,
        AFTER_INSERT,
        AFTER_UPDATE,
        AFTER_DELETE,
        AFTER_UNDELETE;

        /**
         * Looks up a case from its timing and operation words, such as {@code before} and {@code update}.
         */
        public static TriggerCase of(String timing, String operation) {
            return valueOf(timing.toUpperCase(Locale.ROOT) + "_"
                + operation.toUpperCase(Locale.ROOT));
        }
    }

    private final Identifier target;
    private final List<TriggerCase> cases;
    private final CompoundStatement body;

    public TriggerDeclaration(
        Identifier id,
        Identifier target,
        List<TriggerCase> cases,
        CompoundStatement body,
        SourceLocation loc
    ) {
        super(id, List.of(), loc);
        this.target = target;
        this.cases = cases != null ? List.copyOf(cases) : List.of();
        this.body = body;
    }

    public Identifier target() {
        return target;
    }

    public List<TriggerCase> cases() {
        return cases;
    }

    public CompoundStatement body() {
        return body;
    }

    @Override
    protected List<Node> childNodes() {
        return declarationChildren(target, body);
    }
}
