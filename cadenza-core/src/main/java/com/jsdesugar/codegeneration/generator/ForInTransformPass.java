package com.jsdesugar.codegeneration.generator;

import com.jsdesugar.ast.*;
import com.jsdesugar.codegeneration.ParseTreeTransformer;
import com.jsdesugar.codegeneration.UniqueIdentifierGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.jsdesugar.codegeneration.ParseTreeFactory.*;

/**
 * Rewrites {@code for-in} loops so that they can be suspended and resumed. Key
 * enumeration cannot be interrupted, so the keys are collected into an array first and
 * the loop walks that array instead:
 *
 * <pre>
 * for (var k in o) body
 * </pre>
 *
 * becomes
 *
 * <pre>
 * {
 *   var $keys = [], $collection = o;
 *   for (var $p in $collection) $keys.push($p);
 *   for (var $i = 0; $i &lt; $keys.length; $i++) {
 *     var k = $keys[$i];
 *     if (!($keys[$i] in $collection)) continue;
 *     body
 *   }
 * }
 * </pre>
 *
 * Keys deleted while the loop runs are skipped, as they would be by the original loop.
 */
public final class ForInTransformPass extends ParseTreeTransformer {

    private final UniqueIdentifierGenerator identifierGenerator;

    public ForInTransformPass(UniqueIdentifierGenerator identifierGenerator) {
        this.identifierGenerator = Objects.requireNonNull(identifierGenerator, "identifierGenerator");
    }

    @Override
    public Statement transformForInStatement(ForInStatement tree) {
        return lower(tree, null);
    }

    @Override
    public Statement transformLabeledStatement(LabeledStatement tree) {
        if (tree.body() instanceof ForInStatement forIn) {
            return lower(forIn, tree.label());
        }
        return super.transformLabeledStatement(tree);
    }

    // Nested functions were handled when the driver visited them

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

    private Statement lower(ForInStatement tree, Identifier label) {
        Statement body = transformStatement(tree.body());
        Expression object = transformExpression(tree.right());

        Identifier keys = createIdentifierExpression(identifierGenerator.generateUniqueIdentifier());
        Identifier collection = createIdentifierExpression(identifierGenerator.generateUniqueIdentifier());
        Identifier property = createIdentifierExpression(identifierGenerator.generateUniqueIdentifier());
        Identifier index = createIdentifierExpression(identifierGenerator.generateUniqueIdentifier());

        List<Statement> elements = new ArrayList<>();

        // var $keys = [], $collection = object;
        elements.add(createVariableDeclarationList("var", List.of(
            createVariableDeclaration(keys, createEmptyArrayLiteralExpression()),
            createVariableDeclaration(collection, object))));

        // for (var $p in $collection) $keys.push($p);
        elements.add(createForInStatement(
            createVariableDeclarationList("var", List.of(createVariableDeclaration(property, null))),
            collection,
            createExpressionStatement(
                createCallExpression(createMemberExpression(keys, "push"), property))));

        List<Statement> innerBody = new ArrayList<>();

        // var k = $keys[$i];  or  k = $keys[$i];
        Expression lookup = createMemberLookupExpression(keys, index);
        if (tree.left() instanceof VariableDeclaration declaration) {
            Pattern target = declaration.declarations().get(0).id();
            innerBody.add(createVariableDeclarationList(declaration.kind(),
                List.of(createVariableDeclaration(target, lookup))));
        } else if (tree.left() instanceof Pattern target) {
            innerBody.add(createAssignmentStatement(transformPattern(target), lookup));
        } else {
            throw new IllegalArgumentException("Unexpected for-in target: " + tree.left().type());
        }

        // if (!($keys[$i] in $collection)) continue;
        innerBody.add(createIfStatement(
            createUnaryExpression("!", createParenExpression(
                createBinaryExpression(createMemberLookupExpression(keys, index), "in", collection))),
            createContinueStatement()));

        // Kept as its own statement: a block body may redeclare a let-bound loop variable
        innerBody.add(body);

        // for (var $i = 0; $i < $keys.length; $i++) { ... }
        Statement loop = createForStatement(
            createVariableDeclarationList("var", List.of(createVariableDeclaration(index, createNumberLiteral(0)))),
            createBinaryExpression(index, "<", createMemberExpression(keys, "length")),
            createPostfixExpression(index, "++"),
            createBlock(innerBody));
        if (label != null) {
            loop = createLabeledStatement(label, loop);
        }
        elements.add(loop);

        return createBlock(elements);
    }
}
