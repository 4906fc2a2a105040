package io.flowtemplate.core.error;

/**
 * Abstract parent for errors raised while a parsed template is rendered or validated against a
 * context. Thrown by {@code Template.render()}, {@code Template.validateContext()} and by the value
 * coercions the evaluator relies on.
 */
public abstract class TemplateEvalException extends TemplateException {

    private static final long serialVersionUID = 1L;

    protected TemplateEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    protected TemplateEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }
}
