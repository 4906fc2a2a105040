package io.flowtemplate.core.ast;

import io.flowtemplate.core.error.EvaluationException;
import io.flowtemplate.core.error.FunctionException;
import io.flowtemplate.core.error.MathException;
import io.flowtemplate.core.error.TemplateException;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.Value;
import io.flowtemplate.core.spi.FunctionRegistry;
import io.flowtemplate.core.spi.TemplateFunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a tree against one context. Pre-order, left to right: both operands of a binary
 * operator are always evaluated, arguments and pipeline stages run first to last, and only the
 * selected branch of a conditional runs. The first failure aborts the walk.
 *
 * <p>
 * Arithmetic ({@code +} on two numbers, {@code -}, {@code *}, {@code /}, unary minus) is always
 * computed in double precision and yields a float, so {@code 1 + 2} is {@code 3.0}. Only division
 * by zero is a {@link MathException}.
 */
final class Evaluator implements AstVisitor<Value> {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final Context context;
    private final FunctionRegistry functions;

    Evaluator(Context context, FunctionRegistry functions) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
    }

    @Override
    public Value visitLiteral(ExpressionAst.Literal node) {
        return node.value();
    }

    @Override
    public Value visitDataAccess(ExpressionAst.DataAccess node) {
        return context.resolveDataSource(node.source(), node.path());
    }

    @Override
    public Value visitFunctionCall(ExpressionAst.FunctionCall node) {
        TemplateFunction function = lookup(node.name());
        List<Value> args = new ArrayList<>(node.args().size());
        for (ExpressionAst arg : node.args()) {
            args.add(arg.accept(this));
        }
        return invoke(node.name(), function, args);
    }

    @Override
    public Value visitPipeline(ExpressionAst.Pipeline node) {
        Value current = node.input().accept(this);
        for (ExpressionAst.Pipeline.Stage stage : node.stages()) {
            TemplateFunction function = lookup(stage.name());
            List<Value> args = new ArrayList<>(stage.args().size() + 1);
            args.add(current);
            for (ExpressionAst arg : stage.args()) {
                args.add(arg.accept(this));
            }
            current = invoke(stage.name(), function, args);
        }
        return current;
    }

    @Override
    public Value visitBinaryOp(ExpressionAst.BinaryOp node) {
        Value left = node.left().accept(this);
        Value right = node.right().accept(this);
        BinaryOperator op = node.operator();
        return switch (op) {
            case ADD -> add(left, right);
            case SUBTRACT -> arithmetic(left, right, op);
            case MULTIPLY -> arithmetic(left, right, op);
            case DIVIDE -> divide(left, right);
            case EQUAL -> Value.of(left.equals(right));
            case NOT_EQUAL -> Value.of(!left.equals(right));
            case LESS_THAN -> {
                double l = left.asFloat();
                double r = right.asFloat();
                yield Value.of(l < r);
            }
            case AND -> Value.of(left.isTruthy() && right.isTruthy());
            case OR -> Value.of(left.isTruthy() || right.isTruthy());
            // semantics of these are still undecided; they parse but do not evaluate
            case MODULO, LESS_EQUAL, GREATER_THAN, GREATER_EQUAL, CONTAINS, STARTS_WITH, ENDS_WITH -> throw
                    new EvaluationException("Operator '" + op.symbol() + "' (" + op + ") is not implemented");
        };
    }

    @Override
    public Value visitUnaryOp(ExpressionAst.UnaryOp node) {
        Value operand = node.operand().accept(this);
        return switch (node.operator()) {
            case NOT -> Value.of(!operand.isTruthy());
            case MINUS -> negate(operand);
        };
    }

    @Override
    public Value visitTernary(ExpressionAst.Ternary node) {
        return node.condition().accept(this).isTruthy()
                ? node.thenExpr().accept(this)
                : node.elseExpr().accept(this);
    }

    @Override
    public Value visitIfFunction(ExpressionAst.IfFunction node) {
        if (node.condition().accept(this).isTruthy()) {
            return node.thenExpr().accept(this);
        }
        return node.elseBranch().map(e -> e.accept(this)).orElse(Value.NULL);
    }

    // ── Functions ──

    private TemplateFunction lookup(String name) {
        return functions.lookup(name).orElseThrow(() -> FunctionException.notFound(name));
    }

    private static Value invoke(String name, TemplateFunction function, List<Value> args) {
        function.signature().check(name, args.size());
        Value result;
        try {
            result = function.invoke(Collections.unmodifiableList(args));
        } catch (TemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.debug("Function '{}' threw {}", name, e.toString());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new FunctionException(name, reason, describe(args), e);
        }
        if (result == null) {
            throw new FunctionException(name, "Function returned no value", describe(args));
        }
        return result;
    }

    private static List<String> describe(List<Value> args) {
        List<String> out = new ArrayList<>(args.size());
        for (Value arg : args) {
            out.add(arg.toString());
        }
        return out;
    }

    // ── Arithmetic ──

    private static Value add(Value left, Value right) {
        if (left.isNumber() && right.isNumber()) {
            return arithmetic(left, right, BinaryOperator.ADD);
        }
        return Value.of(left.asString() + right.asString());
    }

    private static Value arithmetic(Value left, Value right, BinaryOperator op) {
        double l = left.asFloat();
        double r = right.asFloat();
        return Value.of(
                switch (op) {
                    case ADD -> l + r;
                    case SUBTRACT -> l - r;
                    case MULTIPLY -> l * r;
                    default -> throw new IllegalStateException("not an arithmetic operator: " + op);
                });
    }

    private static Value divide(Value left, Value right) {
        double l = left.asFloat();
        double r = right.asFloat();
        if (r == 0.0) {
            throw new MathException("Division by zero");
        }
        return Value.of(l / r);
    }

    private static Value negate(Value operand) {
        return Value.of(-operand.asFloat());
    }
}
