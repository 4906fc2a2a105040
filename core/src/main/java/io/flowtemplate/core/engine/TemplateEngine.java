package io.flowtemplate.core.engine;

import io.flowtemplate.core.config.EngineConfig;
import io.flowtemplate.core.error.ParseException;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.parser.ExpressionParser;
import io.flowtemplate.core.spi.FunctionRegistry;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that binds a configuration, a function registry and a clock, so callers parse
 * templates and create contexts without repeating them.
 *
 * <p>
 * Thread-safe. The engine holds no per-template state and does not cache parsed templates.
 */
public final class TemplateEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateEngine.class);

    private final EngineConfig config;
    private final FunctionRegistry functions;
    private final Clock clock;
    private final ExpressionParser parser;

    private TemplateEngine(Builder builder) {
        this.config = builder.config;
        this.functions = builder.functions;
        this.clock = builder.clock;
        this.parser = new ExpressionParser(config.maxExpressionDepth());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** An engine with the default configuration, no functions and the system UTC clock. */
    public static TemplateEngine createDefault() {
        return builder().build();
    }

    /**
     * Parses {@code source} under this engine's limits, binding its function registry.
     *
     * @throws ParseException if the source is malformed, longer than
     *                        {@link EngineConfig#maxTemplateLength()}, nests deeper than
     *                        {@link EngineConfig#maxExpressionDepth()}, or, with strict functions,
     *                        calls an unregistered function
     */
    public Template parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        if (source.length() > config.maxTemplateLength()) {
            throw new ParseException(
                    "Template length " + source.length() + " exceeds maximum of " + config.maxTemplateLength(),
                    0,
                    source);
        }
        Template template = Template.compile(source, functions, parser);
        if (config.strictFunctions()) {
            checkFunctions(template);
        }
        return template;
    }

    private void checkFunctions(Template template) {
        for (Expression expr : template.expressions()) {
            for (String name : expr.dependencies().functions()) {
                if (!functions.contains(name)) {
                    LOG.debug("Rejecting template: unknown function '{}' in expression '{}'", name, expr.source());
                    throw new ParseException(
                            "Unknown function '" + name + "'", expr.position(), template.source());
                }
            }
        }
    }

    /** A fresh context whose {@code $system.datetime} is read from this engine's clock. */
    public Context newContext() {
        return new Context(clock);
    }

    public EngineConfig config() {
        return config;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public Clock clock() {
        return clock;
    }

    /** Builder for {@link TemplateEngine}. */
    public static final class Builder {

        private EngineConfig config = EngineConfig.DEFAULT;
        private FunctionRegistry functions = FunctionRegistry.empty();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder functions(FunctionRegistry functions) {
            this.functions = Objects.requireNonNull(functions, "functions must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public TemplateEngine build() {
            return new TemplateEngine(this);
        }
    }
}
