package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

import static com.jsdesugar.codegeneration.ParseTreeFactory.*;
import static com.jsdesugar.codegeneration.generator.YieldAssignments.isYieldAssign;

/**
 * Moves a {@code yield} out of an assignment, a declaration initializer or a return into a
 * statement of its own, followed by the original statement reading the resumed value:
 *
 * <pre>
 * x = yield e, a, b;      =&gt;  { yield e; x = $ctx.sent, a, b; }
 * var x = yield e, y;     =&gt;  { yield e; var x = $ctx.sent, y; }
 * return yield e;         =&gt;  { yield e; return $ctx.sent; }
 * </pre>
 *
 * Only the first element of a comma expression or declarator list is looked at. Any
 * other statement comes back unchanged.
 */
final class YieldExpressionTransformer extends ParseTreeTransformer {

    static final String CONTEXT_NAME = "$ctx";
    static final String SENT_NAME = "sent";

    @Override
    public Statement transformExpressionStatement(ExpressionStatement tree) {
        Expression e = tree.expression();

        // Inside an expression statement the parens around a comma or assignment
        // expression can always go. Revisit if more shapes are matched below.
        while (e instanceof ParenthesizedExpression paren) {
            e = paren.expression();
        }

        List<Expression> expressions;
        if (e instanceof SequenceExpression sequence) {
            expressions = sequence.expressions();
        } else if (isYieldAssign(e)) {
            expressions = List.of(e);
        } else {
            return tree;
        }

        Expression head = expressions.get(0);
        if (!isYieldAssign(head)) {
            return tree;
        }
        List<Expression> tail = expressions.subList(1, expressions.size());
        AssignmentExpression assignment = (AssignmentExpression) head;

        return factorAssign(assignment.left(), (YieldExpression) assignment.right(), (lhs, sent) -> {
            List<Expression> list = new ArrayList<>();
            list.add(createAssignmentExpression(lhs, sent));
            list.addAll(tail);
            return createExpressionStatement(createCommaExpression(list));
        });
    }

    @Override
    public Statement transformVariableDeclaration(VariableDeclaration tree) {
        List<VariableDeclarator> declarations = tree.declarations();
        VariableDeclarator head = declarations.get(0);
        if (!(head.init() instanceof YieldExpression yieldExpression)) {
            return tree;
        }
        List<VariableDeclarator> tail = declarations.subList(1, declarations.size());

        return factorAssign(head.id(), yieldExpression, (lhs, sent) -> {
            List<VariableDeclarator> list = new ArrayList<>();
            list.add(createVariableDeclaration(lhs, sent));
            list.addAll(tail);
            return createVariableDeclarationList(tree.kind(), list);
        });
    }

    @Override
    public Statement transformReturnStatement(ReturnStatement tree) {
        if (tree.argument() instanceof YieldExpression yieldExpression) {
            return factor(yieldExpression, ParseTreeFactory::createReturnStatement);
        }
        return tree;
    }

    // Nested functions keep their own yields

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
        return tree;
    }

    /**
     * Factors out a simple yield assignment.
     *
     * @param lhs  the assignment target
     * @param rhs  the yield expression
     * @param wrap builds the statement that assigns the resumed value to {@code lhs}
     * @return {@code { yield ...; wrap(lhs, $ctx.sent) }}
     */
    private BlockStatement factorAssign(Pattern lhs, YieldExpression rhs,
                                        BiFunction<Pattern, Expression, Statement> wrap) {
        return factor(rhs, sent -> wrap.apply(lhs, sent));
    }

    /**
     * @return {@code { yield ...; wrap($ctx.sent) }}
     */
    private BlockStatement factor(YieldExpression expression, Function<Expression, Statement> wrap) {
        return createBlock(
            createExpressionStatement(expression),
            wrap.apply(createResumedValue()));
    }

    static MemberExpression createResumedValue() {
        return createMemberExpression(CONTEXT_NAME, SENT_NAME);
    }
}
