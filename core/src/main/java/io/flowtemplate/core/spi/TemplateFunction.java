package io.flowtemplate.core.spi;

import io.flowtemplate.core.model.Value;
import java.util.List;

/**
 * A function callable from template expressions, either directly ({@code upper($input.name)}) or
 * as a pipeline stage ({@code $input.name | upper}). A pipeline stage receives the running value as
 * its first argument.
 *
 * <p>
 * Implementations MUST be thread-safe: one instance serves every concurrent render. Failures
 * should be reported by throwing a {@link io.flowtemplate.core.error.TemplateEvalException}
 * subclass; any other runtime exception is wrapped into a
 * {@link io.flowtemplate.core.error.FunctionException} by the evaluator.
 */
@FunctionalInterface
public interface TemplateFunction {

    /**
     * Invokes the function.
     *
     * @param args evaluated arguments, in call order (unmodifiable)
     * @return the result, never {@code null} (use {@link Value#NULL})
     */
    Value invoke(List<Value> args);

    /**
     * The arity this function accepts. Checked by the evaluator before every call.
     *
     * @return the signature; defaults to {@link FunctionSignature#any()}
     */
    default FunctionSignature signature() {
        return FunctionSignature.any();
    }
}
