package com.forcetree.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference to a type, such as {@code Map<Id, List<Account>>} or {@code String[]}.
 *
 * <p>A type with no components is {@code void}.
 */
public final class TypeRef extends Node {

    /**
     * One dotted segment of a type name with its type arguments.
     */
    public static final class Component {
        private final Identifier id;
        private final List<TypeRef> args;

        public Component(Identifier id, List<TypeRef> args) {
            this.id = id;
            this.args = args != null ? List.copyOf(args) : List.of();
        }

        public Identifier id() {
            return id;
        }

        public List<TypeRef> args() {
            return args;
        }
    }

    private final List<Component> components;
    private final int arrayNesting;

    public TypeRef(List<Component> components, int arrayNesting, SourceLocation loc) {
        super(loc);
        this.components = List.copyOf(components);
        this.arrayNesting = arrayNesting;
    }

    public static TypeRef voidType() {
        return new TypeRef(List.of(), 0, SourceLocation.UNKNOWN);
    }

    public static TypeRef of(Identifier id) {
        return new TypeRef(List.of(new Component(id, List.of())), 0, id.loc());
    }

    /**
     * Creates a type from a dotted name. Each component gets its own identifier node.
     */
    public static TypeRef ofQualifiedName(String name, SourceLocation loc) {
        List<Component> components = new ArrayList<>();
        for (String part : name.split("\\.")) {
            components.add(new Component(new Identifier(part, loc), List.of()));
        }
        return new TypeRef(components, 0, loc);
    }

    public List<Component> components() {
        return components;
    }

    public int arrayNesting() {
        return arrayNesting;
    }

    public boolean isVoid() {
        return components.isEmpty();
    }

    public String asCodeString() {
        if (isVoid()) {
            return "void";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(components.stream().map(TypeRef::componentString).collect(Collectors.joining(".")));
        sb.append("[]".repeat(arrayNesting));
        return sb.toString();
    }

    private static String componentString(Component component) {
        if (component.args().isEmpty()) {
            return component.id().string();
        }
        return component.id().string() + "<"
            + component.args().stream().map(TypeRef::asCodeString).collect(Collectors.joining(", "))
            + ">";
    }

    @Override
    protected List<Node> childNodes() {
        List<Node> result = new ArrayList<>();
        for (Component component : components) {
            result.add(component.id());
            result.addAll(component.args());
        }
        return result;
    }

    @Override
    public String toString() {
        return asCodeString();
    }
}
