package io.flowtemplate.core.ast;

/**
 * One method per {@link ExpressionAst} variant. Adding a variant adds a method here, so every
 * walker over the tree fails to compile until it handles the new node.
 *
 * @param <R> result of visiting a node
 */
public interface AstVisitor<R> {

    R visitLiteral(ExpressionAst.Literal node);

    R visitDataAccess(ExpressionAst.DataAccess node);

    R visitFunctionCall(ExpressionAst.FunctionCall node);

    R visitPipeline(ExpressionAst.Pipeline node);

    R visitBinaryOp(ExpressionAst.BinaryOp node);

    R visitUnaryOp(ExpressionAst.UnaryOp node);

    R visitTernary(ExpressionAst.Ternary node);

    R visitIfFunction(ExpressionAst.IfFunction node);
}
