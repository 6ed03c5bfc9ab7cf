package com.forcetree.symbols;

import com.forcetree.ast.ClassDeclaration;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.MethodDeclaration;
import com.forcetree.ast.Node;
import com.forcetree.ast.TypeDeclaration;
import com.forcetree.ast.traversal.Visitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the classes of a set of compilation units, keyed by qualified name.
 */
public final class ClassResolver {

    private ClassResolver() {
    }

    /**
     * @throws SymbolResolutionException if two classes share a qualified name
     */
    public static SymbolTable resolveClassesAndMethods(List<CompilationUnit> units) {
        Map<String, ClassSymbol> classes = new LinkedHashMap<>();
        for (CompilationUnit unit : units) {
            unit.walkSubtree(new Visitor() {
                @Override
                public void visit(Node node) {
                    if (node instanceof ClassDeclaration declaration) {
                        addClass(classes, declaration, unit.file());
                    }
                }
            });
        }
        return new SymbolTable(classes);
    }

    private static void addClass(Map<String, ClassSymbol> classes, ClassDeclaration declaration, String file) {
        String name = declaration.qualifiedName();
        ClassSymbol existing = classes.get(name);
        if (existing != null) {
            throw new SymbolResolutionException("Found (at least) two class definitions for " + name
                + " -- '" + existing.file() + "' and '" + file + "'.");
        }
        MethodCollector collector = new MethodCollector(declaration);
        declaration.walkSubtree(collector);
        classes.put(name, new ClassSymbol(name, declaration, collector.methods, file));
    }

    /**
     * Collects methods without descending into nested types.
     */
    private static class MethodCollector extends Visitor {
        private final ClassDeclaration root;
        private final List<MethodDeclaration> methods = new ArrayList<>();

        MethodCollector(ClassDeclaration root) {
            this.root = root;
        }

        @Override
        public void visit(Node node) {
            if (node instanceof MethodDeclaration method) {
                methods.add(method);
            }
        }

        @Override
        public boolean skipBelow(Node node) {
            return node != root && node instanceof TypeDeclaration;
        }
    }
}
