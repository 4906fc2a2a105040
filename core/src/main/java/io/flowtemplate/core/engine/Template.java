package io.flowtemplate.core.engine;

import io.flowtemplate.core.error.DataNotFoundException;
import io.flowtemplate.core.error.ParseException;
import io.flowtemplate.core.error.TypeConversionException;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.DataSource;
import io.flowtemplate.core.model.Dependencies;
import io.flowtemplate.core.model.Value;
import io.flowtemplate.core.parser.ExpressionParser;
import io.flowtemplate.core.parser.TemplateScanner;
import io.flowtemplate.core.spi.FunctionRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed template: literal text interleaved with <code>{{ expression }}</code> segments.
 *
 * <p>
 * Parsing happens once, in {@link #parse} or {@link #parseWithFunctions}, and fails fast with a
 * {@link ParseException}; a {@code Template} instance is always well-formed. Rendering walks the
 * elements left to right and stops at the first failing expression; nothing is partially
 * returned.
 *
 * <p>
 * Immutable and thread-safe: one template can be rendered concurrently against many contexts,
 * provided the bound function registry is itself thread-safe.
 */
public final class Template {

    private static final Logger LOG = LoggerFactory.getLogger(Template.class);

    private final String source;
    private final List<TemplateElement> elements;
    private final List<Expression> expressions;
    private final Dependencies dependencies;
    private final FunctionRegistry functions;

    private Template(String source, List<TemplateElement> elements, FunctionRegistry functions) {
        this.source = source;
        this.elements = List.copyOf(elements);
        this.functions = functions;

        List<Expression> exprs = new ArrayList<>();
        Dependencies.Builder deps = Dependencies.builder();
        for (TemplateElement element : this.elements) {
            if (element instanceof Expression expr) {
                exprs.add(expr);
                expr.ast().collectDependencies(deps);
            }
        }
        this.expressions = List.copyOf(exprs);
        this.dependencies = deps.build();
    }

    /**
     * Parses {@code source} with no functions available. Same limits as {@link #parseWithFunctions}.
     */
    public static Template parse(String source) {
        return parseWithFunctions(source, FunctionRegistry.empty());
    }

    /**
     * Parses {@code source} and binds {@code functions} for rendering.
     *
     * <p>
     * No template length limit applies here, and expression nesting is capped at the default depth
     * of 64. Templates from untrusted sources should go through {@link TemplateEngine#parse}, which
     * enforces the configured {@code maxTemplateLength} and {@code maxExpressionDepth}.
     *
     * @throws ParseException if the source is malformed or nests deeper than the default depth
     */
    public static Template parseWithFunctions(String source, FunctionRegistry functions) {
        return compile(source, functions, new ExpressionParser());
    }

    static Template compile(String source, FunctionRegistry functions, ExpressionParser parser) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(functions, "functions must not be null");

        List<TemplateElement> elements = new ArrayList<>();
        for (TemplateScanner.Segment segment : TemplateScanner.scan(source)) {
            if (segment.expression()) {
                elements.add(new Expression(
                        segment.text(),
                        parser.parse(segment.text(), source, segment.offset()),
                        utf8Offset(source, segment.start())));
            } else {
                elements.add(new TemplateElement.Text(segment.text()));
            }
        }
        Template template = new Template(source, elements, functions);
        LOG.debug(
                "Parsed template: {} elements, {} expressions, functions={}",
                template.elements.size(),
                template.expressions.size(),
                template.dependencies.functions());
        return template;
    }

    // ── Rendering ──

    /**
     * Renders against {@code context} with the functions bound at parse time.
     *
     * @throws io.flowtemplate.core.error.TemplateEvalException on the first failing expression
     */
    public String render(Context context) {
        return render(context, functions);
    }

    /** Renders against {@code context}, calling functions from {@code functions}. */
    public String render(Context context, FunctionRegistry functions) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(functions, "functions must not be null");
        StringBuilder out = new StringBuilder(source.length());
        for (TemplateElement element : elements) {
            if (element instanceof TemplateElement.Text text) {
                out.append(text.text());
            } else if (element instanceof Expression expr) {
                out.append(display(expr, expr.evaluate(context, functions)));
            }
        }
        return out.toString();
    }

    private static String display(Expression expr, Value value) {
        if (value.isArray() || value.isObject()) {
            throw new TypeConversionException(value.typeName(), "string", expr.source());
        }
        return value.asString();
    }

    /**
     * Checks up front that everything the template may read is present: the input if any
     * {@code $input} path is referenced, every referenced node, and every referenced environment
     * variable. Both branches of every conditional count.
     *
     * @throws DataNotFoundException for the first missing item
     */
    public void validateContext(Context context) {
        if (dependencies.usesInput() && context.getInput().isEmpty()) {
            throw new DataNotFoundException("$input", List.of("Input data required but not provided"));
        }
        for (String nodeId : dependencies.nodeIds()) {
            if (context.getNodeOutput(nodeId).isEmpty()) {
                throw new DataNotFoundException(
                        DataSource.node(nodeId).reference(), context.availableDataSources());
            }
        }
        for (String name : dependencies.envVars()) {
            if (context.getEnv(name).isEmpty()) {
                throw new DataNotFoundException("$env." + name, List.of("Environment variable not set"));
            }
        }
    }

    // ── Queries ──

    public String source() {
        return source;
    }

    public List<TemplateElement> elements() {
        return elements;
    }

    public List<Expression> expressions() {
        return expressions;
    }

    public int expressionCount() {
        return expressions.size();
    }

    /** True if the template contains no expressions and always renders to its own text. */
    public boolean isStatic() {
        return expressions.isEmpty();
    }

    public Dependencies dependencies() {
        return dependencies;
    }

    public boolean usesFunction(String name) {
        return dependencies.functions().contains(name);
    }

    /** The registry used by {@link #render(Context)}. */
    public FunctionRegistry functions() {
        return functions;
    }

    @Override
    public String toString() {
        return source;
    }

    private static int utf8Offset(String text, int charIndex) {
        return text.substring(0, charIndex).getBytes(StandardCharsets.UTF_8).length;
    }
}
