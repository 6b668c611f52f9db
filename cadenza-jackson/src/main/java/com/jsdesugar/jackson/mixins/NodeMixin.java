package com.jsdesugar.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.jsdesugar.ast.*;

/**
 * Maps the ESTree {@code type} property to the node classes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
    @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VariableDeclaration"),
    @JsonSubTypes.Type(value = VariableDeclarator.class, name = "VariableDeclarator"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
    @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
    @JsonSubTypes.Type(value = EmptyStatement.class, name = "EmptyStatement"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = WhileStatement.class, name = "WhileStatement"),
    @JsonSubTypes.Type(value = DoWhileStatement.class, name = "DoWhileStatement"),
    @JsonSubTypes.Type(value = ForStatement.class, name = "ForStatement"),
    @JsonSubTypes.Type(value = ForInStatement.class, name = "ForInStatement"),
    @JsonSubTypes.Type(value = ForOfStatement.class, name = "ForOfStatement"),
    @JsonSubTypes.Type(value = BreakStatement.class, name = "BreakStatement"),
    @JsonSubTypes.Type(value = ContinueStatement.class, name = "ContinueStatement"),
    @JsonSubTypes.Type(value = LabeledStatement.class, name = "LabeledStatement"),
    @JsonSubTypes.Type(value = ThrowStatement.class, name = "ThrowStatement"),
    @JsonSubTypes.Type(value = TryStatement.class, name = "TryStatement"),
    @JsonSubTypes.Type(value = CatchClause.class, name = "CatchClause"),
    @JsonSubTypes.Type(value = SwitchStatement.class, name = "SwitchStatement"),
    @JsonSubTypes.Type(value = SwitchCase.class, name = "SwitchCase"),
    @JsonSubTypes.Type(value = FunctionDeclaration.class, name = "FunctionDeclaration"),
    @JsonSubTypes.Type(value = ClassDeclaration.class, name = "ClassDeclaration"),
    @JsonSubTypes.Type(value = ClassBody.class, name = "ClassBody"),
    @JsonSubTypes.Type(value = MethodDefinition.class, name = "MethodDefinition"),
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = ThisExpression.class, name = "ThisExpression"),
    @JsonSubTypes.Type(value = ArrayExpression.class, name = "ArrayExpression"),
    @JsonSubTypes.Type(value = ObjectExpression.class, name = "ObjectExpression"),
    @JsonSubTypes.Type(value = Property.class, name = "Property"),
    @JsonSubTypes.Type(value = FunctionExpression.class, name = "FunctionExpression"),
    @JsonSubTypes.Type(value = ArrowFunctionExpression.class, name = "ArrowFunctionExpression"),
    @JsonSubTypes.Type(value = ClassExpression.class, name = "ClassExpression"),
    @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
    @JsonSubTypes.Type(value = UpdateExpression.class, name = "UpdateExpression"),
    @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
    @JsonSubTypes.Type(value = LogicalExpression.class, name = "LogicalExpression"),
    @JsonSubTypes.Type(value = AssignmentExpression.class, name = "AssignmentExpression"),
    @JsonSubTypes.Type(value = ConditionalExpression.class, name = "ConditionalExpression"),
    @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
    @JsonSubTypes.Type(value = NewExpression.class, name = "NewExpression"),
    @JsonSubTypes.Type(value = MemberExpression.class, name = "MemberExpression"),
    @JsonSubTypes.Type(value = SequenceExpression.class, name = "SequenceExpression"),
    @JsonSubTypes.Type(value = ParenthesizedExpression.class, name = "ParenthesizedExpression"),
    @JsonSubTypes.Type(value = YieldExpression.class, name = "YieldExpression"),
    @JsonSubTypes.Type(value = AwaitExpression.class, name = "AwaitExpression")
})
public abstract class NodeMixin {
}
