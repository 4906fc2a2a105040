package io.flowtemplate.core.ast;

import io.flowtemplate.core.model.Dependencies;

/**
 * Walks a tree and records every data source and function it references. Nothing is evaluated:
 * both branches of every conditional are visited, so the result covers every render.
 */
final class DependencyCollector implements AstVisitor<Void> {

    private final Dependencies.Builder deps;

    DependencyCollector(Dependencies.Builder deps) {
        this.deps = deps;
    }

    @Override
    public Void visitLiteral(ExpressionAst.Literal node) {
        return null;
    }

    @Override
    public Void visitDataAccess(ExpressionAst.DataAccess node) {
        deps.dataAccess(node.source(), node.path());
        return null;
    }

    @Override
    public Void visitFunctionCall(ExpressionAst.FunctionCall node) {
        deps.function(node.name());
        node.args().forEach(arg -> arg.accept(this));
        return null;
    }

    @Override
    public Void visitPipeline(ExpressionAst.Pipeline node) {
        node.input().accept(this);
        for (ExpressionAst.Pipeline.Stage stage : node.stages()) {
            deps.function(stage.name());
            stage.args().forEach(arg -> arg.accept(this));
        }
        return null;
    }

    @Override
    public Void visitBinaryOp(ExpressionAst.BinaryOp node) {
        node.left().accept(this);
        node.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOp(ExpressionAst.UnaryOp node) {
        node.operand().accept(this);
        return null;
    }

    @Override
    public Void visitTernary(ExpressionAst.Ternary node) {
        node.condition().accept(this);
        node.thenExpr().accept(this);
        node.elseExpr().accept(this);
        return null;
    }

    @Override
    public Void visitIfFunction(ExpressionAst.IfFunction node) {
        node.condition().accept(this);
        node.thenExpr().accept(this);
        node.elseBranch().ifPresent(e -> e.accept(this));
        return null;
    }
}
