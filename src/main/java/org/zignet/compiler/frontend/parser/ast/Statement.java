package org.zignet.compiler.frontend.parser.ast;

/**
 * A statement inside a block.
 */
public sealed interface Statement extends AstNode
        permits BlockStatement, ReturnStatement, IfStatement, WhileStatement, ForStatement,
                BreakStatement, ContinueStatement, ExpressionStatement, VariableDeclaration, ComptimeStatement {

    <R> R accept(StatementVisitor<R> visitor);
}
