package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;

import java.util.List;

/**
 * Helpers for building synthesized nodes. Synthesized nodes carry no source location.
 */
public final class ParseTreeFactory {

    private ParseTreeFactory() {
        // Utility class
    }

    public static Identifier createIdentifierExpression(String name) {
        return new Identifier(null, name);
    }

    /**
     * Creates {@code object.property} for two plain names, e.g. {@code $ctx.sent}.
     */
    public static MemberExpression createMemberExpression(String object, String property) {
        return createMemberExpression(createIdentifierExpression(object), property);
    }

    public static MemberExpression createMemberExpression(Expression object, String property) {
        return new MemberExpression(null, object, createIdentifierExpression(property), false, false);
    }

    public static MemberExpression createMemberLookupExpression(Expression object, Expression index) {
        return new MemberExpression(null, object, index, true, false);
    }

    public static AssignmentExpression createAssignmentExpression(Pattern left, Expression right) {
        return new AssignmentExpression(null, "=", left, right);
    }

    /**
     * Creates a comma expression. A list of one collapses to its only element.
     */
    public static Expression createCommaExpression(List<Expression> expressions) {
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        return new SequenceExpression(null, expressions);
    }

    public static ExpressionStatement createExpressionStatement(Expression expression) {
        return new ExpressionStatement(null, expression, null);
    }

    public static ExpressionStatement createAssignmentStatement(Pattern left, Expression right) {
        return createExpressionStatement(createAssignmentExpression(left, right));
    }

    public static BlockStatement createBlock(List<Statement> statements) {
        return new BlockStatement(null, statements);
    }

    public static BlockStatement createBlock(Statement... statements) {
        return createBlock(List.of(statements));
    }

    public static ReturnStatement createReturnStatement(Expression argument) {
        return new ReturnStatement(null, argument);
    }

    public static VariableDeclarator createVariableDeclaration(Pattern id, Expression init) {
        return new VariableDeclarator(null, id, init);
    }

    public static VariableDeclaration createVariableDeclarationList(String kind, List<VariableDeclarator> declarations) {
        return new VariableDeclaration(null, declarations, kind);
    }

    public static Literal createNumberLiteral(int value) {
        return new Literal(null, value, Integer.toString(value));
    }

    public static ArrayExpression createEmptyArrayLiteralExpression() {
        return new ArrayExpression(null, List.of());
    }

    public static BinaryExpression createBinaryExpression(Expression left, String operator, Expression right) {
        return new BinaryExpression(null, operator, left, right);
    }

    public static UnaryExpression createUnaryExpression(String operator, Expression argument) {
        return new UnaryExpression(null, operator, true, argument);
    }

    public static UpdateExpression createPostfixExpression(Expression argument, String operator) {
        return new UpdateExpression(null, operator, false, argument);
    }

    public static ParenthesizedExpression createParenExpression(Expression expression) {
        return new ParenthesizedExpression(null, expression);
    }

    public static CallExpression createCallExpression(Expression callee, Expression... arguments) {
        return new CallExpression(null, callee, List.of(arguments), false);
    }

    public static ForStatement createForStatement(Node init, Expression test, Expression update, Statement body) {
        return new ForStatement(null, init, test, update, body);
    }

    public static ForInStatement createForInStatement(Node left, Expression right, Statement body) {
        return new ForInStatement(null, left, right, body);
    }

    public static IfStatement createIfStatement(Expression test, Statement consequent) {
        return new IfStatement(null, test, consequent, null);
    }

    public static ContinueStatement createContinueStatement() {
        return new ContinueStatement(null, null);
    }

    public static LabeledStatement createLabeledStatement(Identifier label, Statement body) {
        return new LabeledStatement(null, label, body);
    }
}
