package io.flowtemplate.core.engine;

import java.util.Objects;

/** One piece of a parsed template: literal text or an expression. */
public sealed interface TemplateElement permits TemplateElement.Text, Expression {

    /** Literal text, rendered verbatim. Escaped <code>\{{</code> sequences are already resolved. */
    record Text(String text) implements TemplateElement {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
