package org.zignet.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link Statement} nodes.
 *
 * @param <R> The return type of the visit methods.
 */
public interface StatementVisitor<R> {
    R visitBlock(BlockStatement node);
    R visitReturn(ReturnStatement node);
    R visitIf(IfStatement node);
    R visitWhile(WhileStatement node);
    R visitFor(ForStatement node);
    R visitBreak(BreakStatement node);
    R visitContinue(ContinueStatement node);
    R visitExpression(ExpressionStatement node);
    R visitVariable(VariableDeclaration node);
    R visitComptime(ComptimeStatement node);
}
