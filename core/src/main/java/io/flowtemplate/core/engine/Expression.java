package io.flowtemplate.core.engine;

import io.flowtemplate.core.ast.ExpressionAst;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.Dependencies;
import io.flowtemplate.core.model.Value;
import io.flowtemplate.core.spi.FunctionRegistry;
import java.util.Objects;

/**
 * One <code>{{ ... }}</code> segment of a template.
 *
 * @param source   the trimmed expression text
 * @param ast      the parsed tree
 * @param position UTF-8 byte offset of the opening <code>{{</code> in the template
 */
public record Expression(String source, ExpressionAst ast, int position) implements TemplateElement {

    public Expression {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(ast, "ast must not be null");
    }

    public Value evaluate(Context context, FunctionRegistry functions) {
        return ast.evaluate(context, functions);
    }

    /** True if the expression is a bare data reference such as {@code $input.name}. */
    public boolean isSimpleAccess() {
        return ast instanceof ExpressionAst.DataAccess;
    }

    public boolean isLiteral() {
        return ast instanceof ExpressionAst.Literal;
    }

    public Dependencies dependencies() {
        return ast.dependencies();
    }
}
