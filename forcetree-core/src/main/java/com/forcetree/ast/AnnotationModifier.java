package com.forcetree.ast;

import java.util.List;

/**
 * An annotation such as {@code @IsTest} or {@code @AuraEnabled(cacheable=true)}.
 */
public final class AnnotationModifier extends Modifier {

    private final Identifier name;
    private final List<ElementArgument> args;

    public AnnotationModifier(Identifier name, List<ElementArgument> args, SourceLocation loc) {
        super(loc);
        this.name = name;
        this.args = args != null ? List.copyOf(args) : List.of();
    }

    public Identifier name() {
        return name;
    }

    public List<ElementArgument> args() {
        return args;
    }

    /**
     * Finds an argument by name, ignoring case. A lone unnamed argument answers to {@code value}.
     */
    public ElementArgument argument(String argumentName) {
        for (ElementArgument arg : args) {
            if (arg.nameString().equalsIgnoreCase(argumentName)) {
                return arg;
            }
        }
        return null;
    }

    @Override
    protected List<Node> childNodes() {
        return listOf(name, args);
    }
}
