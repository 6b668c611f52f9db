package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.jsdesugar.codegeneration.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ParseTreeTransformerTest {

    /**
     * Touches most node kinds once.
     */
    private static Program sampleProgram() {
        FunctionExpression method = functionExpression(false, false,
            ParseTreeFactory.createReturnStatement(new ThisExpression(null)));
        Statement tryStatement = new TryStatement(null,
            block(stmt(call("risky"))),
            new CatchClause(null, id("e"), block(new ThrowStatement(null, id("e")))),
            block(new EmptyStatement(null)));
        Statement switchStatement = new SwitchStatement(null, id("x"), List.of(
            new SwitchCase(null, num(1), List.of(new BreakStatement(null, null))),
            new SwitchCase(null, null, List.of(new ContinueStatement(null, id("outer"))))));
        Expression array = new ArrayExpression(null, Arrays.asList(num(1), null, id("y")));
        Expression object = new ObjectExpression(null, List.of(
            new Property(null, id("a"), num(1), "init", false, false, false)));

        return program(
            declare("let", declarator("x", new ConditionalExpression(null, id("a"), array, object))),
            new LabeledStatement(null, id("outer"), new WhileStatement(null, id("c"), block(switchStatement))),
            new DoWhileStatement(null, stmt(new UpdateExpression(null, "++", false, id("i"))),
                new LogicalExpression(null, "&&", id("a"), id("b"))),
            ParseTreeFactory.createForStatement(declare("var", declarator("i", num(0))), null, null,
                stmt(new NewExpression(null, id("Foo"), List.of()))),
            new ForOfStatement(null, id("v"), id("list"), new EmptyStatement(null), false),
            forIn(id("k"), id("o"), stmt(ParseTreeFactory.createUnaryExpression("typeof", id("k")))),
            tryStatement,
            new ClassDeclaration(null, id("C"), id("Base"), new ClassBody(null, List.of(
                new MethodDefinition(null, id("m"), method, "method", false, false)))),
            stmt(comma(ParseTreeFactory.createParenExpression(id("a")),
                ParseTreeFactory.createMemberLookupExpression(id("o"), id("k")))),
            generator("g", stmt(yieldExpr(await(id("p"))))));
    }

    @Test
    void testIdentityTransformReturnsSameTree() {
        Program program = sampleProgram();
        assertSame(program, new ParseTreeTransformer().transformProgram(program));
    }

    @Test
    void testOnlyChangedPathIsRebuilt() {
        Statement untouched = stmt(call("f"));
        Statement touched = declare("var", declarator("x", num(1)));
        Program program = program(untouched, touched);

        ParseTreeTransformer numbersToZero = new ParseTreeTransformer() {
            @Override
            public Expression transformExpression(Expression tree) {
                if (tree instanceof Literal) {
                    return num(0);
                }
                return super.transformExpression(tree);
            }
        };
        Program result = numbersToZero.transformProgram(program);

        assertNotSame(program, result);
        assertSame(untouched, result.body().get(0));
        assertEquals(declare("var", declarator("x", num(0))), result.body().get(1));
    }

    @Test
    void testListIsReusedWhenNothingChanges() {
        List<Statement> statements = List.of(stmt(id("a")), stmt(id("b")));
        assertSame(statements, new ParseTreeTransformer().transformList(statements));
    }

    @Test
    void testArrayHolesSurvive() {
        ParseTreeTransformer renamer = new ParseTreeTransformer() {
            @Override
            public Expression transformExpression(Expression tree) {
                if (tree instanceof Identifier identifier && identifier.name().equals("a")) {
                    return id("b");
                }
                return super.transformExpression(tree);
            }
        };
        ArrayExpression array = new ArrayExpression(null, Arrays.asList(id("a"), null));

        ArrayExpression result = (ArrayExpression) renamer.transformExpression(array);
        assertEquals(Arrays.asList(id("b"), null), result.elements());
    }

    @Test
    void testNonComputedMemberPropertyIsNotVisited() {
        ParseTreeTransformer failOnProperty = new ParseTreeTransformer() {
            @Override
            public Expression transformExpression(Expression tree) {
                if (tree instanceof Identifier identifier && identifier.name().equals("sent")) {
                    fail("property name visited as an expression");
                }
                return super.transformExpression(tree);
            }
        };
        MemberExpression member = sent();
        assertSame(member, failOnProperty.transformExpression(member));
    }
}
