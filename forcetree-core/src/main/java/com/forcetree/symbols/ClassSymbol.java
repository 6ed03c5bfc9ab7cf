package com.forcetree.symbols;

import com.forcetree.ast.ClassDeclaration;
import com.forcetree.ast.MethodDeclaration;

import java.util.List;

/**
 * A class and the methods declared directly in it. Methods of nested classes belong to the
 * nested class's own symbol.
 */
public record ClassSymbol(String qualifiedName, ClassDeclaration classDeclaration, List<MethodDeclaration> methods,
                          String file) {

    public ClassSymbol {
        methods = List.copyOf(methods);
    }
}
