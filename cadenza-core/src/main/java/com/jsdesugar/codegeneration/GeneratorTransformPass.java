package com.jsdesugar.codegeneration;

import com.jsdesugar.TransformOptions;
import com.jsdesugar.ast.*;
import com.jsdesugar.codegeneration.generator.ForInTransformPass;
import com.jsdesugar.codegeneration.generator.StateMachineBuilder;
import com.jsdesugar.util.ErrorReporter;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Finds function bodies with suspend points in them and hands them to a state machine
 * builder for the heavy lifting.
 *
 * <p>Nested functions are transformed before the function around them. A body is only
 * touched when it belongs to a generator, or when deferred functions are enabled, and it
 * actually contains a {@code yield} or an {@code await}. Such a body then has its
 * {@code for-in} loops lowered, and either has its yields factored out and goes to the
 * generator builder, or goes straight to the async builder.
 *
 * <p>A node whose body did not change is returned as the same instance, so callers can
 * tell whether anything happened with a reference comparison.
 */
public class GeneratorTransformPass extends ParseTreeTransformer {

    private static final Logger logger = Logger.getLogger(GeneratorTransformPass.class.getName());

    private final UniqueIdentifierGenerator identifierGenerator;
    private final ErrorReporter reporter;
    private final TransformOptions options;
    private final StateMachineBuilder generatorBuilder;
    private final StateMachineBuilder asyncBuilder;

    public GeneratorTransformPass(UniqueIdentifierGenerator identifierGenerator,
                                  ErrorReporter reporter,
                                  TransformOptions options,
                                  StateMachineBuilder generatorBuilder,
                                  StateMachineBuilder asyncBuilder) {
        this.identifierGenerator = Objects.requireNonNull(identifierGenerator, "identifierGenerator");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.options = Objects.requireNonNull(options, "options");
        this.generatorBuilder = Objects.requireNonNull(generatorBuilder, "generatorBuilder");
        this.asyncBuilder = Objects.requireNonNull(asyncBuilder, "asyncBuilder");
    }

    @Override
    public Statement transformFunctionDeclaration(FunctionDeclaration tree) {
        TransformedBody result = transformBody(tree.body(), tree.generator(), describe(tree.id()));
        if (result.body() == tree.body()) {
            return tree;
        }
        FunctionDeclaration function = tree.withBody(result.body());
        // The generator has been transformed away
        return result.lowered() ? function.withGenerator(false) : function;
    }

    @Override
    public Expression transformFunctionExpression(FunctionExpression tree) {
        return transformFunction(tree, describe(tree.id()));
    }

    /**
     * Transforms a get or set accessor of an object literal. Other properties, including
     * generator methods, go through {@link #transformFunctionExpression}.
     */
    @Override
    public Property transformProperty(Property tree) {
        if (!tree.isAccessor() || !(tree.value() instanceof FunctionExpression accessor)) {
            return super.transformProperty(tree);
        }
        Expression key = tree.computed() ? transformExpression(tree.key()) : tree.key();
        FunctionExpression value = transformAccessor(accessor, tree.kind(), key);
        if (key == tree.key() && value == accessor) {
            return tree;
        }
        return tree.withKey(key).withValue(value);
    }

    /**
     * Transforms a get or set accessor of a class, keeping its name and static-ness.
     */
    @Override
    public MethodDefinition transformMethodDefinition(MethodDefinition tree) {
        if (!tree.isAccessor()) {
            return super.transformMethodDefinition(tree);
        }
        Expression key = tree.computed() ? transformExpression(tree.key()) : tree.key();
        FunctionExpression value = transformAccessor(tree.value(), tree.kind(), key);
        if (key == tree.key() && value == tree.value()) {
            return tree;
        }
        return tree.withKey(key).withValue(value);
    }

    private FunctionExpression transformFunction(FunctionExpression tree, String name) {
        TransformedBody result = transformBody(tree.body(), tree.generator(), name);
        if (result.body() == tree.body()) {
            return tree;
        }
        FunctionExpression function = tree.withBody(result.body());
        return result.lowered() ? function.withGenerator(false) : function;
    }

    private FunctionExpression transformAccessor(FunctionExpression accessor, String kind, Expression key) {
        // Accessors cannot be generators; only deferred functions apply to them
        TransformedBody result = transformBody(accessor.body(), false, kind + " " + describe(key));
        if (result.body() == accessor.body()) {
            return accessor;
        }
        return accessor.withBody(result.body());
    }

    private TransformedBody transformBody(BlockStatement tree, boolean isGenerator, String name) {
        // transform nested functions
        BlockStatement body = super.transformFunctionBody(tree);

        if (!isGenerator && !options.deferredFunctions()) {
            return TransformedBody.withoutBuilder(body);
        }

        SuspendPoints points = YieldFinder.analyze(body);
        if (!points.hasAnySuspend()) {
            return TransformedBody.withoutBuilder(body);
        }

        // We need to transform for-in loops because the object key iteration
        // cannot be interrupted.
        if (points.hasForIn() && (options.generators() || options.deferredFunctions())) {
            logger.finer(() -> "Lowering for-in loops in " + name);
            body = new ForInTransformPass(identifierGenerator).transformFunctionBody(body);
        }

        if (points.hasYield() || isGenerator) {
            if (options.generators()) {
                body = new YieldExpressionTransformer().transformFunctionBody(body);
                logger.fine(() -> "Lowering generator " + name);
                body = generatorBuilder.transformBody(identifierGenerator, reporter, body);
                return TransformedBody.byBuilder(body);
            }
        } else if (options.deferredFunctions()) {
            logger.fine(() -> "Lowering deferred function " + name);
            body = asyncBuilder.transformBody(identifierGenerator, reporter, body);
            return TransformedBody.byBuilder(body);
        }
        return TransformedBody.withoutBuilder(body);
    }

    private static String describe(Node name) {
        if (name instanceof Identifier id) {
            return id.name();
        } else if (name instanceof Literal literal) {
            return String.valueOf(literal.value());
        }
        return "<anonymous>";
    }

    /**
     * @param lowered whether a state machine builder produced {@code body}
     */
    private record TransformedBody(BlockStatement body, boolean lowered) {
        static TransformedBody byBuilder(BlockStatement body) {
            return new TransformedBody(body, true);
        }

        static TransformedBody withoutBuilder(BlockStatement body) {
            return new TransformedBody(body, false);
        }
    }
}
