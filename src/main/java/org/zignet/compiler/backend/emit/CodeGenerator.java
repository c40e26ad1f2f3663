package org.zignet.compiler.backend.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.compiler.frontend.parser.Precedence;
import org.zignet.compiler.frontend.parser.ast.*;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The final stage of the pipeline. It prints a syntax tree as canonically formatted source.
 * <p>
 * Output is deterministic: generating, re-parsing and generating again yields the same text.
 * Parentheses are only printed where the {@link Precedence} of a child would otherwise change
 * the shape of the tree. An instance is not thread-safe.
 */
public class CodeGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodeGenerator.class);

    private final CodeGenOptions options;
    private final DeclarationEmitter declarationEmitter = new DeclarationEmitter();
    private final StatementEmitter statementEmitter = new StatementEmitter();
    private final ExpressionEmitter expressionEmitter = new ExpressionEmitter();
    private final TypeEmitter typeEmitter = new TypeEmitter();
    private SourceWriter out;

    public CodeGenerator() {
        this(CodeGenOptions.defaults());
    }

    public CodeGenerator(CodeGenOptions options) {
        this.options = options;
    }

    /**
     * Generates source for a program. Top-level declarations are separated by one blank line.
     *
     * @param program The program to print.
     * @return The formatted source, ending with a single newline; empty for an empty program.
     */
    public String generate(Program program) {
        out = new SourceWriter(options.indentUnit());
        List<Declaration> declarations = program.declarations();
        for (int i = 0; i < declarations.size(); i++) {
            if (i > 0) {
                out.blankLine();
            }
            declarations.get(i).accept(declarationEmitter);
        }
        String result = out.toString();
        LOGGER.debug("Generated {} characters for {} declarations", result.length(), declarations.size());
        return result;
    }

    // ---- helpers ----

    private String expression(Expression expression) {
        return expression.accept(expressionEmitter);
    }

    private String type(TypeAnnotation annotation) {
        return annotation.accept(typeEmitter);
    }

    private String variable(VariableDeclaration node) {
        StringBuilder text = new StringBuilder();
        if (node.isInline()) text.append("inline ");
        if (node.isComptime()) text.append("comptime ");
        text.append(node.isConst() ? "const " : "var ").append(node.name());
        if (node.typeAnnotation() != null) {
            text.append(": ").append(type(node.typeAnnotation()));
        }
        if (node.initializer() != null) {
            text.append(" = ").append(expression(node.initializer()));
        }
        return text.append(';').toString();
    }

    private void blockContents(BlockStatement block) {
        out.indent();
        for (Statement statement : block.statements()) {
            statement.accept(statementEmitter);
        }
        out.dedent();
    }

    /**
     * Prints a header followed by its body. A block body opens a brace on the header line and
     * is left open; any other body goes on its own line one level deeper.
     *
     * @return {@code true} if a brace was opened and the caller must close it.
     */
    private boolean openBody(String header, Statement body) {
        if (body instanceof BlockStatement block) {
            out.line(header + " {");
            blockContents(block);
            return true;
        }
        out.line(header);
        out.indent();
        body.accept(statementEmitter);
        out.dedent();
        return false;
    }

    private void ifChain(IfStatement node, String lead) {
        boolean open = openBody(lead + "if (" + expression(node.condition()) + ")", node.consequent());
        Statement alternate = node.alternate();
        if (alternate == null) {
            if (open) out.line("}");
            return;
        }
        String elseLead = open ? "} else" : "else";
        if (alternate instanceof IfStatement elseIf) {
            ifChain(elseIf, elseLead + " ");
        } else if (openBody(elseLead, alternate)) {
            out.line("}");
        }
    }

    private void container(String name, String keyword, List<String> members) {
        out.line("const " + name + " = " + keyword + " {");
        out.indent();
        members.forEach(member -> out.line(member + ","));
        out.dedent();
        out.line("};");
    }

    private <T> String join(List<T> items, Function<T, String> render) {
        return items.stream().map(render).collect(Collectors.joining(", "));
    }

    private static String quote(String value) {
        StringBuilder text = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> text.append("\\\\");
                case '"' -> text.append("\\\"");
                case '\n' -> text.append("\\n");
                case '\r' -> text.append("\\r");
                case '\t' -> text.append("\\t");
                default -> text.append(c);
            }
        }
        return text.append('"').toString();
    }

    private class DeclarationEmitter implements DeclarationVisitor<Void> {

        @Override
        public Void visitFunction(FunctionDeclaration node) {
            StringBuilder header = new StringBuilder();
            if (node.isInline()) header.append("inline ");
            if (node.isComptime()) header.append("comptime ");
            header.append("fn ").append(node.name())
                    .append('(').append(join(node.parameters(), this::parameter)).append(") ");
            if (node.errorUnion()) header.append('!');
            header.append(type(node.returnType()));

            if (options.newlineBeforeBrace()) {
                out.line(header.toString());
                out.line("{");
            } else {
                out.line(header + " {");
            }
            blockContents(node.body());
            out.line("}");
            return null;
        }

        private String parameter(Parameter parameter) {
            return (parameter.isComptime() ? "comptime " : "") + parameter.name() + ": " + type(parameter.typeAnnotation());
        }

        @Override
        public Void visitVariable(VariableDeclaration node) {
            out.line(variable(node));
            return null;
        }

        @Override
        public Void visitStruct(StructDeclaration node) {
            container(node.name(), "struct", fields(node.fields()));
            return null;
        }

        @Override
        public Void visitUnion(UnionDeclaration node) {
            container(node.name(), "union", fields(node.fields()));
            return null;
        }

        @Override
        public Void visitEnum(EnumDeclaration node) {
            List<String> members = node.members().stream()
                    .map(member -> member.value() == null
                            ? member.name()
                            : member.name() + " = " + expression(member.value()))
                    .collect(Collectors.toList());
            container(node.name(), "enum", members);
            return null;
        }

        private List<String> fields(List<ContainerField> fields) {
            return fields.stream()
                    .map(field -> field.name() + ": " + type(field.typeAnnotation()))
                    .collect(Collectors.toList());
        }
    }

    private class StatementEmitter implements StatementVisitor<Void> {

        @Override
        public Void visitBlock(BlockStatement node) {
            out.line("{");
            blockContents(node);
            out.line("}");
            return null;
        }

        @Override
        public Void visitReturn(ReturnStatement node) {
            out.line(node.value() == null ? "return;" : "return " + expression(node.value()) + ";");
            return null;
        }

        @Override
        public Void visitIf(IfStatement node) {
            ifChain(node, "");
            return null;
        }

        @Override
        public Void visitWhile(WhileStatement node) {
            if (openBody("while (" + expression(node.condition()) + ")", node.body())) {
                out.line("}");
            }
            return null;
        }

        @Override
        public Void visitFor(ForStatement node) {
            StringBuilder header = new StringBuilder("for (");
            Statement initializer = node.initializer();
            if (initializer instanceof VariableDeclaration declaration) {
                header.append(variable(declaration));
            } else if (initializer instanceof ExpressionStatement statement) {
                header.append(expression(statement.expression())).append(';');
            } else if (initializer == null) {
                header.append(';');
            } else {
                throw new IllegalStateException("Unsupported for-loop initializer: " + initializer.getClass().getSimpleName());
            }
            if (node.condition() != null) {
                header.append(' ').append(expression(node.condition()));
            }
            header.append(';');
            if (node.increment() != null) {
                header.append(' ').append(expression(node.increment()));
            }
            header.append(')');

            if (openBody(header.toString(), node.body())) {
                out.line("}");
            }
            return null;
        }

        @Override
        public Void visitBreak(BreakStatement node) {
            out.line("break;");
            return null;
        }

        @Override
        public Void visitContinue(ContinueStatement node) {
            out.line("continue;");
            return null;
        }

        @Override
        public Void visitExpression(ExpressionStatement node) {
            out.line(expression(node.expression()) + ";");
            return null;
        }

        @Override
        public Void visitVariable(VariableDeclaration node) {
            out.line(variable(node));
            return null;
        }

        @Override
        public Void visitComptime(ComptimeStatement node) {
            out.line("comptime {");
            blockContents(node.body());
            out.line("}");
            return null;
        }
    }

    private class ExpressionEmitter implements ExpressionVisitor<String> {

        private String operand(Expression child, boolean parenthesize) {
            String text = expression(child);
            return parenthesize ? "(" + text + ")" : text;
        }

        private String postfixTarget(Expression target) {
            return operand(target, precedenceOf(target).ordinal() < Precedence.POSTFIX.ordinal());
        }

        @Override
        public String visitBinary(BinaryExpression node) {
            Precedence own = Precedence.ofBinaryOperator(node.operator());
            // Left-associative: an equal tier on the right needs parentheses, on the left it does not.
            String left = operand(node.left(), own.bindsTighterThan(precedenceOf(node.left())));
            String right = operand(node.right(), !precedenceOf(node.right()).bindsTighterThan(own));
            return left + " " + node.operator() + " " + right;
        }

        @Override
        public String visitUnary(UnaryExpression node) {
            return node.operator() + operand(node.operand(), Precedence.UNARY.bindsTighterThan(precedenceOf(node.operand())));
        }

        @Override
        public String visitCall(CallExpression node) {
            return postfixTarget(node.callee()) + "(" + join(node.arguments(), CodeGenerator.this::expression) + ")";
        }

        @Override
        public String visitMemberAccess(MemberAccessExpression node) {
            return postfixTarget(node.object()) + "." + node.property();
        }

        @Override
        public String visitIndex(IndexExpression node) {
            return postfixTarget(node.object()) + "[" + expression(node.index()) + "]";
        }

        @Override
        public String visitIdentifier(Identifier node) {
            return node.name();
        }

        @Override
        public String visitNumber(NumberLiteral node) {
            return node.value().stripTrailingZeros().toPlainString();
        }

        @Override
        public String visitString(StringLiteral node) {
            return quote(node.value());
        }

        @Override
        public String visitBoolean(BooleanLiteral node) {
            return Boolean.toString(node.value());
        }

        @Override
        public String visitStructLiteral(StructLiteral node) {
            if (node.fields().isEmpty()) {
                return node.typeName() + "{}";
            }
            return node.typeName() + "{ "
                    + join(node.fields(), field -> "." + field.name() + " = " + expression(field.value()))
                    + " }";
        }

        @Override
        public String visitArrayLiteral(ArrayLiteral node) {
            if (node.elements().isEmpty()) {
                return "[_]{}";
            }
            return "[_]{ " + join(node.elements(), CodeGenerator.this::expression) + " }";
        }

        @Override
        public String visitAssignment(AssignmentExpression node) {
            // Right-associative: only the target may need parentheses.
            String target = operand(node.left(), !precedenceOf(node.left()).bindsTighterThan(Precedence.ASSIGNMENT));
            return target + " " + node.operator() + " " + expression(node.right());
        }
    }

    private class TypeEmitter implements TypeAnnotationVisitor<String> {

        @Override
        public String visitPrimitive(PrimitiveType node) {
            return node.name();
        }

        @Override
        public String visitNamed(NamedType node) {
            return node.name();
        }

        @Override
        public String visitPointer(PointerType node) {
            return "*" + node.pointeeType().accept(this);
        }

        @Override
        public String visitArray(ArrayType node) {
            return "[" + (node.size() == null ? "" : node.size()) + "]" + node.elementType().accept(this);
        }

        @Override
        public String visitErrorUnion(ErrorUnionType node) {
            return "!" + node.valueType().accept(this);
        }

        @Override
        public String visitOptional(OptionalType node) {
            return "?" + node.valueType().accept(this);
        }
    }

    /**
     * Returns the tier that produces an expression node when parsed.
     */
    static Precedence precedenceOf(Expression expression) {
        return expression.accept(PRECEDENCE);
    }

    private static final ExpressionVisitor<Precedence> PRECEDENCE = new ExpressionVisitor<>() {
        @Override
        public Precedence visitBinary(BinaryExpression node) {
            return Precedence.ofBinaryOperator(node.operator());
        }

        @Override
        public Precedence visitUnary(UnaryExpression node) {
            return Precedence.UNARY;
        }

        @Override
        public Precedence visitCall(CallExpression node) {
            return Precedence.POSTFIX;
        }

        @Override
        public Precedence visitMemberAccess(MemberAccessExpression node) {
            return Precedence.POSTFIX;
        }

        @Override
        public Precedence visitIndex(IndexExpression node) {
            return Precedence.POSTFIX;
        }

        @Override
        public Precedence visitIdentifier(Identifier node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitNumber(NumberLiteral node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitString(StringLiteral node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitBoolean(BooleanLiteral node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitStructLiteral(StructLiteral node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitArrayLiteral(ArrayLiteral node) {
            return Precedence.PRIMARY;
        }

        @Override
        public Precedence visitAssignment(AssignmentExpression node) {
            return Precedence.ASSIGNMENT;
        }
    };
}
