package com.forcetree.ast;

public abstract sealed class Statement extends Node permits
    CompoundStatement,
    IfStatement,
    SwitchStatement,
    ForLoopStatement,
    EnhancedForLoopStatement,
    WhileLoopStatement,
    DoWhileLoopStatement,
    TryStatement,
    ReturnStatement,
    ThrowStatement,
    BreakStatement,
    ContinueStatement,
    RunAsStatement,
    VariableDeclarationStatement,
    ExpressionStatement,
    DmlStatement,
    UntranslatedStatement {

    protected Statement(SourceLocation loc) {
        super(loc);
    }
}
