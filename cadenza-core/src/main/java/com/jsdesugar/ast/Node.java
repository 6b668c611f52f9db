package com.jsdesugar.ast;

/**
 * Base interface for all ESTree AST nodes.
 *
 * <p>Nodes are immutable values. A transform that needs a different child builds a new
 * parent and leaves the old tree untouched, so unchanged subtrees may be shared between
 * the input and output trees.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    VariableDeclarator,
    Property,
    CatchClause,
    SwitchCase,
    ClassBody,
    MethodDefinition {

    String type();

    /**
     * Source range of this node, or null for nodes synthesized by a transform.
     */
    SourceLocation loc();
}
