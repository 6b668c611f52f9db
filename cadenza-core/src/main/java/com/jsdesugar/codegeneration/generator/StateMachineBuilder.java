package com.jsdesugar.codegeneration.generator;

import com.jsdesugar.ast.BlockStatement;
import com.jsdesugar.codegeneration.UniqueIdentifierGenerator;
import com.jsdesugar.util.ErrorReporter;

/**
 * Lowers a normalized function body into an explicit, resumable state machine.
 *
 * <p>A generator builder receives bodies in which every {@code yield} already sits in an
 * expression statement of its own (see {@code YieldExpressionTransformer}). An async
 * builder receives bodies whose only suspend points are {@code await} expressions.
 * Exceptions thrown by a builder propagate to whoever started the pass.
 */
@FunctionalInterface
public interface StateMachineBuilder {

    BlockStatement transformBody(UniqueIdentifierGenerator identifierGenerator,
                                 ErrorReporter reporter,
                                 BlockStatement body);
}
