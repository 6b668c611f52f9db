package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jsdesugar.codegeneration.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class YieldExpressionTransformerTest {

    private final YieldExpressionTransformer transformer = new YieldExpressionTransformer();

    @Test
    void testAssignment() {
        // x = yield 1;
        Statement input = stmt(assign("x", yieldExpr(num(1))));

        Statement expected = block(
            stmt(yieldExpr(num(1))),
            stmt(assign("x", sent())));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testAssignmentKeepsRestOfCommaExpression() {
        // x = yield 1, a, b;
        Statement input = stmt(comma(assign("x", yieldExpr(num(1))), id("a"), id("b")));

        Statement expected = block(
            stmt(yieldExpr(num(1))),
            stmt(comma(assign("x", sent()), id("a"), id("b"))));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testAssignmentToMember() {
        // o.p = yield;
        MemberExpression target = ParseTreeFactory.createMemberExpression("o", "p");
        Statement input = stmt(ParseTreeFactory.createAssignmentExpression(target, yieldExpr(null)));

        Statement expected = block(
            stmt(yieldExpr(null)),
            stmt(ParseTreeFactory.createAssignmentExpression(target, sent())));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testParenthesesAreDropped() {
        // ((x = yield 1));
        Statement input = stmt(ParseTreeFactory.createParenExpression(
            ParseTreeFactory.createParenExpression(assign("x", yieldExpr(num(1))))));

        Statement expected = block(
            stmt(yieldExpr(num(1))),
            stmt(assign("x", sent())));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testVariableDeclaration() {
        // let x = yield 1, y = 2, z;
        Statement input = declare("let",
            declarator("x", yieldExpr(num(1))),
            declarator("y", num(2)),
            declarator("z", null));

        Statement expected = block(
            stmt(yieldExpr(num(1))),
            declare("let",
                declarator("x", sent()),
                declarator("y", num(2)),
                declarator("z", null)));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testVariableDeclarationKeepsKind() {
        for (String kind : List.of("var", "let", "const")) {
            Statement result = transformer.transformStatement(declare(kind, declarator("x", yieldExpr(num(1)))));

            BlockStatement block = assertInstanceOf(BlockStatement.class, result);
            VariableDeclaration declaration = assertInstanceOf(VariableDeclaration.class, block.body().get(1));
            assertEquals(kind, declaration.kind());
        }
    }

    @Test
    void testReturn() {
        // return yield x;
        Statement input = ParseTreeFactory.createReturnStatement(yieldExpr(id("x")));

        Statement expected = block(
            stmt(yieldExpr(id("x"))),
            ParseTreeFactory.createReturnStatement(sent()));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testDelegatingYieldIsFactoredToo() {
        YieldExpression delegate = new YieldExpression(null, true, call("inner"));
        Statement result = transformer.transformStatement(stmt(assign("x", delegate)));

        assertEquals(block(stmt(delegate), stmt(assign("x", sent()))), result);
    }

    @Test
    void testOtherStatementsAreReturnedAsIs() {
        List<Statement> statements = List.of(
            stmt(yieldExpr(num(1))),                       // yield 1;
            stmt(call("f", yieldExpr(num(1)))),            // f(yield 1);
            stmt(assign("x", num(1))),                     // x = 1;
            stmt(new AssignmentExpression(null, "+=", id("x"), yieldExpr(num(1)))), // x += yield 1;
            declare("var", declarator("x", call("f"))),    // var x = f();
            ParseTreeFactory.createReturnStatement(null),  // return;
            ParseTreeFactory.createReturnStatement(call("f", yieldExpr(num(1))))); // return f(yield 1);

        for (Statement statement : statements) {
            assertSame(statement, transformer.transformStatement(statement), statement.toString());
        }
    }

    @Test
    void testOnlyFirstCommaElementIsLookedAt() {
        // a = 1, x = yield 2;
        Statement sequence = stmt(comma(assign("a", num(1)), assign("x", yieldExpr(num(2)))));
        // var a = 1, x = yield 2;
        Statement declaration = declare("var", declarator("a", num(1)), declarator("x", yieldExpr(num(2))));

        assertSame(sequence, transformer.transformStatement(sequence));
        assertSame(declaration, transformer.transformStatement(declaration));
    }

    @Test
    void testStatementsInsideControlFlowAreFactored() {
        // if (c) x = yield 1; else { return yield 2; }
        Statement input = new IfStatement(null, id("c"),
            stmt(assign("x", yieldExpr(num(1)))),
            block(ParseTreeFactory.createReturnStatement(yieldExpr(num(2)))));

        Statement expected = new IfStatement(null, id("c"),
            block(stmt(yieldExpr(num(1))), stmt(assign("x", sent()))),
            block(block(stmt(yieldExpr(num(2))), ParseTreeFactory.createReturnStatement(sent()))));
        assertEquals(expected, transformer.transformStatement(input));
    }

    @Test
    void testNestedFunctionsAreNotEntered() {
        Statement factorable = stmt(assign("x", yieldExpr(num(1))));
        BlockStatement body = block(
            generator("inner", factorable),
            stmt(ParseTreeFactory.createCallExpression(functionExpression(true, false, factorable))),
            stmt(arrow(false, factorable)));

        assertSame(body, transformer.transformFunctionBody(body));
    }

    @Test
    void testUnchangedBodyIsSameInstance() {
        BlockStatement body = block(stmt(call("f")), declare("var", declarator("x", num(1))));
        assertSame(body, transformer.transformFunctionBody(body));
    }
}
