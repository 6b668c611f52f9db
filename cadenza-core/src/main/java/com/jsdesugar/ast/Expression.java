package com.jsdesugar.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    ThisExpression,
    ArrayExpression,
    ObjectExpression,
    FunctionExpression,
    ArrowFunctionExpression,
    ClassExpression,
    UnaryExpression,
    UpdateExpression,
    BinaryExpression,
    LogicalExpression,
    AssignmentExpression,
    ConditionalExpression,
    CallExpression,
    NewExpression,
    MemberExpression,
    SequenceExpression,
    ParenthesizedExpression,
    YieldExpression,
    AwaitExpression {
}
