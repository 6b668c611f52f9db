package com.jsdesugar.codegeneration.generator;

import com.jsdesugar.ast.AssignmentExpression;
import com.jsdesugar.ast.Expression;
import com.jsdesugar.ast.YieldExpression;

public final class YieldAssignments {

    private YieldAssignments() {
    }

    /**
     * True for a plain {@code lhs = yield ...}. Compound assignments read the target
     * before suspending and are not factored.
     */
    public static boolean isYieldAssign(Expression tree) {
        return tree instanceof AssignmentExpression assignment
            && "=".equals(assignment.operator())
            && assignment.right() instanceof YieldExpression;
    }
}
