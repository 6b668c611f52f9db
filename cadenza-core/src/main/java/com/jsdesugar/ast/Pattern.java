package com.jsdesugar.ast;

/**
 * Assignment and binding targets.
 */
public sealed interface Pattern extends Node permits Identifier, MemberExpression {
}
