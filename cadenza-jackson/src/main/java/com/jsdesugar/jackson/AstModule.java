package com.jsdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsdesugar.ast.*;
import com.jsdesugar.jackson.mixins.NodeMixin;

/**
 * Jackson module for the AST classes. Registers the {@code type} property through
 * {@link NodeMixin} and keeps the nullable fields that ESTree always writes.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.jsdesugar", "cadenza-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Pattern.class, NodeMixin.class);

        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(Property.class, PropertyMixin.class);
        context.setMixInAnnotations(MethodDefinition.class, MethodDefinitionMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(FunctionExpression.class, FunctionIdMixin.class);
        context.setMixInAnnotations(FunctionDeclaration.class, FunctionIdMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(TryStatement.class, TryStatementMixin.class);
        context.setMixInAnnotations(ForStatement.class, ForStatementMixin.class);
        context.setMixInAnnotations(CatchClause.class, CatchClauseMixin.class);
        context.setMixInAnnotations(ClassDeclaration.class, ClassMixin.class);
        context.setMixInAnnotations(ClassExpression.class, ClassMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ArgumentMixin.class);
        context.setMixInAnnotations(YieldExpression.class, ArgumentMixin.class);
        context.setMixInAnnotations(BreakStatement.class, LabelMixin.class);
        context.setMixInAnnotations(ContinueStatement.class, LabelMixin.class);
        context.setMixInAnnotations(SwitchCase.class, SwitchCaseMixin.class);
    }

    private abstract static class LiteralMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class PropertyMixin {
        @JsonIgnore
        abstract boolean isAccessor();
    }

    private abstract static class MethodDefinitionMixin {
        @JsonProperty("static")
        abstract boolean isStatic();

        @JsonIgnore
        abstract boolean isAccessor();
    }

    private abstract static class VariableDeclaratorMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    private abstract static class FunctionIdMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
    }

    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    private abstract static class TryStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CatchClause handler();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract BlockStatement finalizer();
    }

    private abstract static class ForStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node init();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression update();
    }

    // ES2019 allows catch without a binding
    private abstract static class CatchClauseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Pattern param();
    }

    private abstract static class ClassMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    private abstract static class ArgumentMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class LabelMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier label();
    }

    // null for the default case
    private abstract static class SwitchCaseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
    }
}
