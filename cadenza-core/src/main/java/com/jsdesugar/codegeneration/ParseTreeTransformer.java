package com.jsdesugar.codegeneration;

import com.jsdesugar.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive, identity-preserving rewriter over the AST.
 *
 * <p>Each {@code transformXxx} method returns the very same instance it was given when none
 * of the node's children changed. Callers rely on this to detect "nothing to do" with a
 * reference comparison, and unchanged subtrees end up shared between the old and the new
 * tree. Subclasses override the methods for the node kinds they rewrite and call
 * {@code super} to keep recursing.
 */
public class ParseTreeTransformer {

    // ========================================================================
    // Dispatch
    // ========================================================================

    public Node transformAny(Node tree) {
        if (tree == null) {
            return null;
        }
        if (tree instanceof Program program) {
            return transformProgram(program);
        } else if (tree instanceof Statement statement) {
            return transformStatement(statement);
        } else if (tree instanceof Expression expression) {
            return transformExpression(expression);
        } else if (tree instanceof VariableDeclarator declarator) {
            return transformVariableDeclarator(declarator);
        } else if (tree instanceof Property property) {
            return transformProperty(property);
        } else if (tree instanceof CatchClause catchClause) {
            return transformCatchClause(catchClause);
        } else if (tree instanceof SwitchCase switchCase) {
            return transformSwitchCase(switchCase);
        } else if (tree instanceof ClassBody classBody) {
            return transformClassBody(classBody);
        } else if (tree instanceof MethodDefinition method) {
            return transformMethodDefinition(method);
        }
        throw new IllegalArgumentException("Unhandled node type: " + tree.type());
    }

    public Statement transformStatement(Statement tree) {
        if (tree == null) {
            return null;
        }
        if (tree instanceof ExpressionStatement s) {
            return transformExpressionStatement(s);
        } else if (tree instanceof VariableDeclaration s) {
            return transformVariableDeclaration(s);
        } else if (tree instanceof ReturnStatement s) {
            return transformReturnStatement(s);
        } else if (tree instanceof BlockStatement s) {
            return transformBlockStatement(s);
        } else if (tree instanceof EmptyStatement s) {
            return s;
        } else if (tree instanceof IfStatement s) {
            return transformIfStatement(s);
        } else if (tree instanceof WhileStatement s) {
            return transformWhileStatement(s);
        } else if (tree instanceof DoWhileStatement s) {
            return transformDoWhileStatement(s);
        } else if (tree instanceof ForStatement s) {
            return transformForStatement(s);
        } else if (tree instanceof ForInStatement s) {
            return transformForInStatement(s);
        } else if (tree instanceof ForOfStatement s) {
            return transformForOfStatement(s);
        } else if (tree instanceof BreakStatement s) {
            return s;
        } else if (tree instanceof ContinueStatement s) {
            return s;
        } else if (tree instanceof LabeledStatement s) {
            return transformLabeledStatement(s);
        } else if (tree instanceof ThrowStatement s) {
            return transformThrowStatement(s);
        } else if (tree instanceof TryStatement s) {
            return transformTryStatement(s);
        } else if (tree instanceof SwitchStatement s) {
            return transformSwitchStatement(s);
        } else if (tree instanceof FunctionDeclaration s) {
            return transformFunctionDeclaration(s);
        } else if (tree instanceof ClassDeclaration s) {
            return transformClassDeclaration(s);
        }
        throw new IllegalArgumentException("Unhandled statement type: " + tree.type());
    }

    public Expression transformExpression(Expression tree) {
        if (tree == null) {
            return null;
        }
        if (tree instanceof Identifier e) {
            return e;
        } else if (tree instanceof Literal e) {
            return e;
        } else if (tree instanceof ThisExpression e) {
            return e;
        } else if (tree instanceof ArrayExpression e) {
            return transformArrayExpression(e);
        } else if (tree instanceof ObjectExpression e) {
            return transformObjectExpression(e);
        } else if (tree instanceof FunctionExpression e) {
            return transformFunctionExpression(e);
        } else if (tree instanceof ArrowFunctionExpression e) {
            return transformArrowFunctionExpression(e);
        } else if (tree instanceof ClassExpression e) {
            return transformClassExpression(e);
        } else if (tree instanceof UnaryExpression e) {
            return transformUnaryExpression(e);
        } else if (tree instanceof UpdateExpression e) {
            return transformUpdateExpression(e);
        } else if (tree instanceof BinaryExpression e) {
            return transformBinaryExpression(e);
        } else if (tree instanceof LogicalExpression e) {
            return transformLogicalExpression(e);
        } else if (tree instanceof AssignmentExpression e) {
            return transformAssignmentExpression(e);
        } else if (tree instanceof ConditionalExpression e) {
            return transformConditionalExpression(e);
        } else if (tree instanceof CallExpression e) {
            return transformCallExpression(e);
        } else if (tree instanceof NewExpression e) {
            return transformNewExpression(e);
        } else if (tree instanceof MemberExpression e) {
            return transformMemberExpression(e);
        } else if (tree instanceof SequenceExpression e) {
            return transformSequenceExpression(e);
        } else if (tree instanceof ParenthesizedExpression e) {
            return transformParenthesizedExpression(e);
        } else if (tree instanceof YieldExpression e) {
            return transformYieldExpression(e);
        } else if (tree instanceof AwaitExpression e) {
            return transformAwaitExpression(e);
        }
        throw new IllegalArgumentException("Unhandled expression type: " + tree.type());
    }

    public Pattern transformPattern(Pattern tree) {
        if (tree instanceof MemberExpression member) {
            return transformMemberExpression(member);
        }
        return tree;
    }

    /**
     * Transforms every element of a list, returning the original list if no element
     * changed. Null elements (array holes) are kept as they are.
     */
    @SuppressWarnings("unchecked")
    public <T extends Node> List<T> transformList(List<T> list) {
        List<T> result = null;
        for (int i = 0; i < list.size(); i++) {
            T element = list.get(i);
            T transformed = (T) transformAny(element);
            if (result == null && transformed != element) {
                result = new ArrayList<>(list.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result == null ? list : result;
    }

    // ========================================================================
    // Program and function bodies
    // ========================================================================

    public Program transformProgram(Program tree) {
        List<Statement> body = transformList(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new Program(tree.loc(), body, tree.sourceType());
    }

    public BlockStatement transformFunctionBody(BlockStatement tree) {
        return transformBlockStatement(tree);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    public Statement transformExpressionStatement(ExpressionStatement tree) {
        Expression expression = transformExpression(tree.expression());
        if (expression == tree.expression()) {
            return tree;
        }
        return new ExpressionStatement(tree.loc(), expression, tree.directive());
    }

    /**
     * Transforms a variable declaration in statement position. Subclasses may replace it
     * with any statement.
     */
    public Statement transformVariableDeclaration(VariableDeclaration tree) {
        return transformVariableDeclarationList(tree);
    }

    /**
     * Transforms a variable declaration that must stay a declaration, such as the head of
     * a {@code for} or {@code for-in} loop.
     */
    public VariableDeclaration transformVariableDeclarationList(VariableDeclaration tree) {
        List<VariableDeclarator> declarations = transformList(tree.declarations());
        if (declarations == tree.declarations()) {
            return tree;
        }
        return new VariableDeclaration(tree.loc(), declarations, tree.kind());
    }

    public VariableDeclarator transformVariableDeclarator(VariableDeclarator tree) {
        Pattern id = transformPattern(tree.id());
        Expression init = transformExpression(tree.init());
        if (id == tree.id() && init == tree.init()) {
            return tree;
        }
        return new VariableDeclarator(tree.loc(), id, init);
    }

    public Statement transformReturnStatement(ReturnStatement tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new ReturnStatement(tree.loc(), argument);
    }

    public BlockStatement transformBlockStatement(BlockStatement tree) {
        List<Statement> body = transformList(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new BlockStatement(tree.loc(), body);
    }

    public Statement transformIfStatement(IfStatement tree) {
        Expression test = transformExpression(tree.test());
        Statement consequent = transformStatement(tree.consequent());
        Statement alternate = transformStatement(tree.alternate());
        if (test == tree.test() && consequent == tree.consequent() && alternate == tree.alternate()) {
            return tree;
        }
        return new IfStatement(tree.loc(), test, consequent, alternate);
    }

    public Statement transformWhileStatement(WhileStatement tree) {
        Expression test = transformExpression(tree.test());
        Statement body = transformStatement(tree.body());
        if (test == tree.test() && body == tree.body()) {
            return tree;
        }
        return new WhileStatement(tree.loc(), test, body);
    }

    public Statement transformDoWhileStatement(DoWhileStatement tree) {
        Statement body = transformStatement(tree.body());
        Expression test = transformExpression(tree.test());
        if (body == tree.body() && test == tree.test()) {
            return tree;
        }
        return new DoWhileStatement(tree.loc(), body, test);
    }

    public Statement transformForStatement(ForStatement tree) {
        Node init = transformLoopHead(tree.init());
        Expression test = transformExpression(tree.test());
        Expression update = transformExpression(tree.update());
        Statement body = transformStatement(tree.body());
        if (init == tree.init() && test == tree.test() && update == tree.update() && body == tree.body()) {
            return tree;
        }
        return new ForStatement(tree.loc(), init, test, update, body);
    }

    public Statement transformForInStatement(ForInStatement tree) {
        Node left = transformLoopHead(tree.left());
        Expression right = transformExpression(tree.right());
        Statement body = transformStatement(tree.body());
        if (left == tree.left() && right == tree.right() && body == tree.body()) {
            return tree;
        }
        return new ForInStatement(tree.loc(), left, right, body);
    }

    public Statement transformForOfStatement(ForOfStatement tree) {
        Node left = transformLoopHead(tree.left());
        Expression right = transformExpression(tree.right());
        Statement body = transformStatement(tree.body());
        if (left == tree.left() && right == tree.right() && body == tree.body()) {
            return tree;
        }
        return new ForOfStatement(tree.loc(), left, right, body, tree.await());
    }

    private Node transformLoopHead(Node head) {
        if (head instanceof VariableDeclaration declaration) {
            return transformVariableDeclarationList(declaration);
        } else if (head instanceof Pattern pattern) {
            return transformPattern(pattern);
        }
        return transformAny(head);
    }

    public Statement transformLabeledStatement(LabeledStatement tree) {
        Statement body = transformStatement(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new LabeledStatement(tree.loc(), tree.label(), body);
    }

    public Statement transformThrowStatement(ThrowStatement tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new ThrowStatement(tree.loc(), argument);
    }

    public Statement transformTryStatement(TryStatement tree) {
        BlockStatement block = transformBlockStatement(tree.block());
        CatchClause handler = tree.handler() == null ? null : transformCatchClause(tree.handler());
        BlockStatement finalizer = tree.finalizer() == null ? null : transformBlockStatement(tree.finalizer());
        if (block == tree.block() && handler == tree.handler() && finalizer == tree.finalizer()) {
            return tree;
        }
        return new TryStatement(tree.loc(), block, handler, finalizer);
    }

    public CatchClause transformCatchClause(CatchClause tree) {
        BlockStatement body = transformBlockStatement(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new CatchClause(tree.loc(), tree.param(), body);
    }

    public Statement transformSwitchStatement(SwitchStatement tree) {
        Expression discriminant = transformExpression(tree.discriminant());
        List<SwitchCase> cases = transformList(tree.cases());
        if (discriminant == tree.discriminant() && cases == tree.cases()) {
            return tree;
        }
        return new SwitchStatement(tree.loc(), discriminant, cases);
    }

    public SwitchCase transformSwitchCase(SwitchCase tree) {
        Expression test = transformExpression(tree.test());
        List<Statement> consequent = transformList(tree.consequent());
        if (test == tree.test() && consequent == tree.consequent()) {
            return tree;
        }
        return new SwitchCase(tree.loc(), test, consequent);
    }

    // ========================================================================
    // Functions and classes
    // ========================================================================

    public Statement transformFunctionDeclaration(FunctionDeclaration tree) {
        BlockStatement body = transformFunctionBody(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return tree.withBody(body);
    }

    public Expression transformFunctionExpression(FunctionExpression tree) {
        BlockStatement body = transformFunctionBody(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return tree.withBody(body);
    }

    public Expression transformArrowFunctionExpression(ArrowFunctionExpression tree) {
        Node body = tree.body() instanceof BlockStatement block
            ? transformFunctionBody(block)
            : transformAny(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new ArrowFunctionExpression(tree.loc(), tree.expression(), tree.async(), tree.params(), body);
    }

    public Statement transformClassDeclaration(ClassDeclaration tree) {
        Expression superClass = transformExpression(tree.superClass());
        ClassBody body = transformClassBody(tree.body());
        if (superClass == tree.superClass() && body == tree.body()) {
            return tree;
        }
        return new ClassDeclaration(tree.loc(), tree.id(), superClass, body);
    }

    public Expression transformClassExpression(ClassExpression tree) {
        Expression superClass = transformExpression(tree.superClass());
        ClassBody body = transformClassBody(tree.body());
        if (superClass == tree.superClass() && body == tree.body()) {
            return tree;
        }
        return new ClassExpression(tree.loc(), tree.id(), superClass, body);
    }

    public ClassBody transformClassBody(ClassBody tree) {
        List<MethodDefinition> body = transformList(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new ClassBody(tree.loc(), body);
    }

    public MethodDefinition transformMethodDefinition(MethodDefinition tree) {
        Expression key = tree.computed() ? transformExpression(tree.key()) : tree.key();
        Expression value = transformFunctionExpression(tree.value());
        if (key == tree.key() && value == tree.value()) {
            return tree;
        }
        // A function expression transform may only hand back a function expression here
        return new MethodDefinition(tree.loc(), key, (FunctionExpression) value,
            tree.kind(), tree.computed(), tree.isStatic());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public Expression transformArrayExpression(ArrayExpression tree) {
        List<Expression> elements = transformList(tree.elements());
        if (elements == tree.elements()) {
            return tree;
        }
        return new ArrayExpression(tree.loc(), elements);
    }

    public Expression transformObjectExpression(ObjectExpression tree) {
        List<Property> properties = transformList(tree.properties());
        if (properties == tree.properties()) {
            return tree;
        }
        return new ObjectExpression(tree.loc(), properties);
    }

    public Property transformProperty(Property tree) {
        Expression key = tree.computed() ? transformExpression(tree.key()) : tree.key();
        Expression value = transformExpression(tree.value());
        if (key == tree.key() && value == tree.value()) {
            return tree;
        }
        return new Property(tree.loc(), key, value, tree.kind(), tree.method(), tree.shorthand(), tree.computed());
    }

    public Expression transformUnaryExpression(UnaryExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new UnaryExpression(tree.loc(), tree.operator(), tree.prefix(), argument);
    }

    public Expression transformUpdateExpression(UpdateExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new UpdateExpression(tree.loc(), tree.operator(), tree.prefix(), argument);
    }

    public Expression transformBinaryExpression(BinaryExpression tree) {
        Expression left = transformExpression(tree.left());
        Expression right = transformExpression(tree.right());
        if (left == tree.left() && right == tree.right()) {
            return tree;
        }
        return new BinaryExpression(tree.loc(), tree.operator(), left, right);
    }

    public Expression transformLogicalExpression(LogicalExpression tree) {
        Expression left = transformExpression(tree.left());
        Expression right = transformExpression(tree.right());
        if (left == tree.left() && right == tree.right()) {
            return tree;
        }
        return new LogicalExpression(tree.loc(), tree.operator(), left, right);
    }

    public Expression transformAssignmentExpression(AssignmentExpression tree) {
        Pattern left = transformPattern(tree.left());
        Expression right = transformExpression(tree.right());
        if (left == tree.left() && right == tree.right()) {
            return tree;
        }
        return new AssignmentExpression(tree.loc(), tree.operator(), left, right);
    }

    public Expression transformConditionalExpression(ConditionalExpression tree) {
        Expression test = transformExpression(tree.test());
        Expression consequent = transformExpression(tree.consequent());
        Expression alternate = transformExpression(tree.alternate());
        if (test == tree.test() && consequent == tree.consequent() && alternate == tree.alternate()) {
            return tree;
        }
        return new ConditionalExpression(tree.loc(), test, consequent, alternate);
    }

    public Expression transformCallExpression(CallExpression tree) {
        Expression callee = transformExpression(tree.callee());
        List<Expression> arguments = transformList(tree.arguments());
        if (callee == tree.callee() && arguments == tree.arguments()) {
            return tree;
        }
        return new CallExpression(tree.loc(), callee, arguments, tree.optional());
    }

    public Expression transformNewExpression(NewExpression tree) {
        Expression callee = transformExpression(tree.callee());
        List<Expression> arguments = transformList(tree.arguments());
        if (callee == tree.callee() && arguments == tree.arguments()) {
            return tree;
        }
        return new NewExpression(tree.loc(), callee, arguments);
    }

    public MemberExpression transformMemberExpression(MemberExpression tree) {
        Expression object = transformExpression(tree.object());
        // a.b's property is a name, not a reference
        Expression property = tree.computed() ? transformExpression(tree.property()) : tree.property();
        if (object == tree.object() && property == tree.property()) {
            return tree;
        }
        return new MemberExpression(tree.loc(), object, property, tree.computed(), tree.optional());
    }

    public Expression transformSequenceExpression(SequenceExpression tree) {
        List<Expression> expressions = transformList(tree.expressions());
        if (expressions == tree.expressions()) {
            return tree;
        }
        return new SequenceExpression(tree.loc(), expressions);
    }

    public Expression transformParenthesizedExpression(ParenthesizedExpression tree) {
        Expression expression = transformExpression(tree.expression());
        if (expression == tree.expression()) {
            return tree;
        }
        return new ParenthesizedExpression(tree.loc(), expression);
    }

    public Expression transformYieldExpression(YieldExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new YieldExpression(tree.loc(), tree.delegate(), argument);
    }

    public Expression transformAwaitExpression(AwaitExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new AwaitExpression(tree.loc(), argument);
    }
}
