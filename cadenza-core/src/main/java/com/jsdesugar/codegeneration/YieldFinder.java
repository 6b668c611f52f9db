package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;

/**
 * Scans a function body for suspend points and for-in loops.
 *
 * <p>Nested functions and class bodies are not entered: the suspend points inside them belong
 * to those functions.
 */
public final class YieldFinder extends ParseTreeTransformer {

    private boolean hasYield;
    private boolean hasAwait;
    private boolean hasForIn;

    private YieldFinder() {
    }

    public static SuspendPoints analyze(BlockStatement body) {
        YieldFinder finder = new YieldFinder();
        finder.transformBlockStatement(body);
        return new SuspendPoints(finder.hasYield, finder.hasAwait, finder.hasForIn);
    }

    @Override
    public Expression transformYieldExpression(YieldExpression tree) {
        hasYield = true;
        return super.transformYieldExpression(tree);
    }

    @Override
    public Expression transformAwaitExpression(AwaitExpression tree) {
        hasAwait = true;
        return super.transformAwaitExpression(tree);
    }

    @Override
    public Statement transformForInStatement(ForInStatement tree) {
        hasForIn = true;
        return super.transformForInStatement(tree);
    }

    @Override
    public Statement transformForOfStatement(ForOfStatement tree) {
        if (tree.await()) {
            hasAwait = true;
        }
        return super.transformForOfStatement(tree);
    }

    @Override
    public Statement transformFunctionDeclaration(FunctionDeclaration tree) {
        return tree;
    }

    @Override
    public Expression transformFunctionExpression(FunctionExpression tree) {
        return tree;
    }

    @Override
    public Expression transformArrowFunctionExpression(ArrowFunctionExpression tree) {
        return tree;
    }

    @Override
    public ClassBody transformClassBody(ClassBody tree) {
        // The heritage expression still runs in this function; the members do not
        return tree;
    }
}
