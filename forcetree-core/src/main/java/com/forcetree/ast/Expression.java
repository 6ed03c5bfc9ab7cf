package com.forcetree.ast;

public abstract sealed class Expression extends Node permits
    LiteralExpression,
    BinaryExpression,
    UnaryExpression,
    AssignExpression,
    CallExpression,
    FieldExpression,
    ArrayExpression,
    CastExpression,
    NewExpression,
    TernaryExpression,
    ThisExpression,
    SuperExpression,
    TypeRefExpression,
    VariableExpression,
    SoqlOrSoslExpression,
    UntranslatedExpression {

    protected Expression(SourceLocation loc) {
        super(loc);
    }
}
