package com.jsdesugar.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    VariableDeclaration,
    ReturnStatement,
    BlockStatement,
    EmptyStatement,
    IfStatement,
    WhileStatement,
    DoWhileStatement,
    ForStatement,
    ForInStatement,
    ForOfStatement,
    BreakStatement,
    ContinueStatement,
    LabeledStatement,
    ThrowStatement,
    TryStatement,
    SwitchStatement,
    FunctionDeclaration,
    ClassDeclaration {
}
