package io.flowtemplate.core.ast;

import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.DataSource;
import io.flowtemplate.core.model.Dependencies;
import io.flowtemplate.core.model.Value;
import io.flowtemplate.core.spi.FunctionRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of one template expression. A strict tree: nodes own their children, there are no
 * back-references, and every node is immutable, so a tree can be shared by concurrent renders.
 *
 * <p>
 * Walkers implement {@link AstVisitor}; {@link #evaluate} and {@link #collectDependencies} are the
 * two walks the engine performs.
 */
public sealed interface ExpressionAst
        permits ExpressionAst.Literal,
                ExpressionAst.DataAccess,
                ExpressionAst.FunctionCall,
                ExpressionAst.Pipeline,
                ExpressionAst.BinaryOp,
                ExpressionAst.UnaryOp,
                ExpressionAst.Ternary,
                ExpressionAst.IfFunction {

    <R> R accept(AstVisitor<R> visitor);

    /**
     * Evaluates this tree against a context.
     *
     * @param context   the data sources to read
     * @param functions the functions callable from the tree
     * @return the resulting value
     * @throws io.flowtemplate.core.error.TemplateEvalException on the first failing step
     */
    default Value evaluate(Context context, FunctionRegistry functions) {
        return accept(new Evaluator(context, functions));
    }

    /** Records every data source and function this tree references, without evaluating it. */
    default void collectDependencies(Dependencies.Builder deps) {
        accept(new DependencyCollector(deps));
    }

    /** The dependencies of this tree alone. */
    default Dependencies dependencies() {
        Dependencies.Builder deps = Dependencies.builder();
        collectDependencies(deps);
        return deps.build();
    }

    // ── Variants ──

    /** A constant: {@code null}, {@code true}, {@code 42}, {@code 'text'}. */
    record Literal(Value value) implements ExpressionAst {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * A read from a data source: {@code $input.user.name}, {@code $node('fetch').body}.
     *
     * @param path dotted path below the source root, {@code ""} for the root itself
     */
    record DataAccess(DataSource source, String path) implements ExpressionAst {
        public DataAccess {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDataAccess(this);
        }
    }

    /** A direct call: {@code name(arg, ...)}. */
    record FunctionCall(String name, List<ExpressionAst> args) implements ExpressionAst {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /** {@code input | stage | stage(args)}: each stage receives the running value first. */
    record Pipeline(ExpressionAst input, List<Stage> stages) implements ExpressionAst {
        public Pipeline {
            Objects.requireNonNull(input, "input must not be null");
            stages = List.copyOf(stages);
            if (stages.isEmpty()) {
                throw new IllegalArgumentException("a pipeline needs at least one stage");
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitPipeline(this);
        }

        /** One {@code | name(args)} step. */
        public record Stage(String name, List<ExpressionAst> args) {
            public Stage {
                Objects.requireNonNull(name, "name must not be null");
                args = List.copyOf(args);
            }
        }
    }

    record BinaryOp(ExpressionAst left, BinaryOperator operator, ExpressionAst right) implements ExpressionAst {
        public BinaryOp {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    record UnaryOp(UnaryOperator operator, ExpressionAst operand) implements ExpressionAst {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /** {@code condition ? thenExpr : elseExpr}. */
    record Ternary(ExpressionAst condition, ExpressionAst thenExpr, ExpressionAst elseExpr) implements ExpressionAst {
        public Ternary {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenExpr, "thenExpr must not be null");
            Objects.requireNonNull(elseExpr, "elseExpr must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTernary(this);
        }
    }

    /**
     * {@code if(condition, thenExpr[, elseExpr])}. Without an else branch a false condition yields
     * null.
     *
     * @param elseExpr the else branch, or {@code null} when absent
     */
    record IfFunction(ExpressionAst condition, ExpressionAst thenExpr, ExpressionAst elseExpr)
            implements ExpressionAst {
        public IfFunction {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(thenExpr, "thenExpr must not be null");
        }

        public Optional<ExpressionAst> elseBranch() {
            return Optional.ofNullable(elseExpr);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIfFunction(this);
        }
    }
}
