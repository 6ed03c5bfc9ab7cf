package com.forcetree.symbols;

import com.forcetree.ast.MethodDeclaration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolved classes sorted by qualified name.
 */
public class SymbolTable {

    private final TreeMap<String, ClassSymbol> classes;

    public SymbolTable(Map<String, ClassSymbol> classes) {
        this.classes = new TreeMap<>(classes);
    }

    public ClassSymbol get(String qualifiedName) {
        return classes.get(qualifiedName);
    }

    public boolean contains(String qualifiedName) {
        return classes.containsKey(qualifiedName);
    }

    public List<String> classNames() {
        return new ArrayList<>(classes.keySet());
    }

    public Collection<ClassSymbol> classes() {
        return classes.values();
    }

    public int size() {
        return classes.size();
    }

    /**
     * Renders every class and its methods, for example:
     *
     * <pre>
     * Class: Outer
     * * Outer()
     * * run(Integer count): void
     * </pre>
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (ClassSymbol symbol : classes.values()) {
            sb.append("Class: ").append(symbol.qualifiedName()).append('\n');
            List<MethodDeclaration> methods = new ArrayList<>(symbol.methods());
            methods.sort(Comparator.comparing((MethodDeclaration m) -> !m.isConstructor())
                .thenComparing(m -> m.id().string()));
            for (MethodDeclaration method : methods) {
                sb.append("* ").append(method.id().string())
                    .append('(').append(readableParameters(method)).append(')');
                if (!method.isConstructor()) {
                    sb.append(": ").append(method.returnType().asCodeString());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static String readableParameters(MethodDeclaration method) {
        return method.parameterDeclarations().stream()
            .map(p -> p.type().asCodeString() + " " + p.id().string())
            .collect(Collectors.joining(", "));
    }
}
