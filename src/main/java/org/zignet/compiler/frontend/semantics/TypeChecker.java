package org.zignet.compiler.frontend.semantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.compiler.diagnostics.Diagnostic;
import org.zignet.compiler.diagnostics.DiagnosticsEngine;
import org.zignet.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Performs semantic analysis on the AST: name resolution, scope handling and type checking.
 * <p>
 * The checker runs two passes over the top-level declarations. The first collects functions,
 * structs, unions and enums into the global scope so they can be used before their
 * declaration. The second checks every declaration in source order; top-level variables
 * become visible from their declaration onward.
 * <p>
 * Semantic problems never abort the pass. They are collected as {@link Diagnostic}s and can be
 * read through {@link #getErrors()} afterwards. An instance is not thread-safe.
 */
public class TypeChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeChecker.class);

    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> LOGICAL_OPERATORS = Set.of("and", "or");

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final DeclarationChecker declarationChecker = new DeclarationChecker();
    private final StatementChecker statementChecker = new StatementChecker();
    private final ExpressionChecker expressionChecker = new ExpressionChecker();
    private final TypeResolver typeResolver = new TypeResolver();

    private SymbolTable symbolTable;
    private Type currentReturnType;
    private int loopDepth;

    /**
     * Checks the given program. Diagnostics of an earlier call are discarded.
     * @param program The program to check.
     */
    public void check(Program program) {
        diagnostics.clear();
        symbolTable = new SymbolTable(diagnostics);
        currentReturnType = null;
        loopDepth = 0;

        collectDeclarations(program.declarations());
        for (Declaration declaration : program.declarations()) {
            declaration.accept(declarationChecker);
        }
        LOGGER.debug("Type check of {} declarations produced {} diagnostics",
                program.declarations().size(), diagnostics.getDiagnostics().size());
    }

    /**
     * @return The diagnostics of the last {@link #check(Program)} call, in reporting order.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.getDiagnostics();
    }

    // ---- pass 1: collection ----

    private void collectDeclarations(List<Declaration> declarations) {
        Map<Declaration, Type> containers = new LinkedHashMap<>();
        List<FunctionDeclaration> functions = new ArrayList<>();

        // Container names first, so fields and signatures can refer to any of them.
        for (Declaration declaration : declarations) {
            Type type = null;
            if (declaration instanceof StructDeclaration) {
                type = Type.struct(declaration.name());
            } else if (declaration instanceof UnionDeclaration) {
                type = Type.union(declaration.name());
            } else if (declaration instanceof EnumDeclaration) {
                type = Type.enumeration(declaration.name());
            } else if (declaration instanceof FunctionDeclaration function) {
                functions.add(function);
            }
            if (type != null) {
                containers.put(declaration, type);
                symbolTable.define(new Symbol(declaration.name(), Symbol.Kind.TYPE, type, true, declaration));
            }
        }

        containers.forEach((declaration, type) -> {
            if (declaration instanceof StructDeclaration struct) {
                collectFields(type, struct.fields(), "struct");
            } else if (declaration instanceof UnionDeclaration union) {
                collectFields(type, union.fields(), "union");
            } else if (declaration instanceof EnumDeclaration enumeration) {
                for (EnumMember member : enumeration.members()) {
                    if (!type.addMember(member.name())) {
                        diagnostics.reportError("Duplicate member '" + member.name() + "' in enum '" + type.name() + "'",
                                member.line(), member.column());
                    }
                }
            }
        });

        for (FunctionDeclaration function : functions) {
            symbolTable.define(new Symbol(function.name(), Symbol.Kind.FUNCTION, functionType(function), true, function));
        }
    }

    private void collectFields(Type container, List<ContainerField> fields, String keyword) {
        for (ContainerField field : fields) {
            if (!container.addField(field.name(), resolve(field.typeAnnotation()))) {
                diagnostics.reportError("Duplicate field '" + field.name() + "' in " + keyword + " '" + container.name() + "'",
                        field.line(), field.column());
            }
        }
    }

    private Type functionType(FunctionDeclaration function) {
        List<Type> parameterTypes = new ArrayList<>();
        for (Parameter parameter : function.parameters()) {
            parameterTypes.add(resolve(parameter.typeAnnotation()));
        }
        return Type.function(parameterTypes, resolve(function.returnType()));
    }

    private Type resolveName(String name) {
        return symbolTable.resolve(name).map(Symbol::type).orElse(Type.UNKNOWN);
    }

    private Type resolve(TypeAnnotation annotation) {
        return annotation.accept(typeResolver);
    }

    // ---- pass 2: checking ----

    private void checkVariable(VariableDeclaration node) {
        Type type;
        if (node.typeAnnotation() != null) {
            type = resolve(node.typeAnnotation());
            if (node.initializer() != null) {
                Type initializerType = check(node.initializer());
                if (!type.accepts(initializerType)) {
                    diagnostics.reportError("Cannot assign value of type '" + initializerType.name()
                            + "' to variable of type '" + type.name() + "'", node.line(), node.column());
                }
            }
        } else if (node.initializer() != null) {
            type = check(node.initializer());
        } else {
            diagnostics.reportError("Variable '" + node.name() + "' must have either a type annotation or initializer",
                    node.line(), node.column());
            type = Type.UNKNOWN;
        }
        symbolTable.define(new Symbol(node.name(), Symbol.Kind.VARIABLE, type, node.isConst(), node));
    }

    private void checkBlock(BlockStatement block) {
        symbolTable.enterScope();
        for (Statement statement : block.statements()) {
            statement.accept(statementChecker);
        }
        symbolTable.leaveScope();
    }

    private void checkCondition(Expression condition, String construct, AstNode owner) {
        Type type = check(condition);
        if (!type.isBool() && !type.isUnknown()) {
            diagnostics.reportError(construct + " condition must be of type 'bool', got '" + type.name() + "'",
                    owner.line(), owner.column());
        }
    }

    private void checkLoopBody(Statement body) {
        loopDepth++;
        body.accept(statementChecker);
        loopDepth--;
    }

    private Type check(Expression expression) {
        return expression.accept(expressionChecker);
    }

    /**
     * A non-void function must end every path with a return. Only returns at block level
     * and if/else chains whose branches all return count.
     */
    private static boolean guaranteesReturn(Statement statement) {
        if (statement instanceof ReturnStatement) {
            return true;
        }
        if (statement instanceof BlockStatement block) {
            return block.statements().stream().anyMatch(TypeChecker::guaranteesReturn);
        }
        if (statement instanceof IfStatement ifStatement) {
            return ifStatement.alternate() != null
                    && guaranteesReturn(ifStatement.consequent())
                    && guaranteesReturn(ifStatement.alternate());
        }
        return false;
    }

    private class DeclarationChecker implements DeclarationVisitor<Void> {

        @Override
        public Void visitFunction(FunctionDeclaration node) {
            Type returnType = resolve(node.returnType());
            Type enclosingReturnType = currentReturnType;
            int enclosingLoopDepth = loopDepth;
            currentReturnType = returnType;
            loopDepth = 0;

            symbolTable.enterScope();
            for (Parameter parameter : node.parameters()) {
                symbolTable.define(new Symbol(parameter.name(), Symbol.Kind.PARAMETER,
                        resolve(parameter.typeAnnotation()), true, parameter));
            }
            checkBlock(node.body());
            symbolTable.leaveScope();

            if (returnType.kind() != Type.Kind.VOID && !guaranteesReturn(node.body())) {
                diagnostics.reportError("Function '" + node.name() + "' must return a value of type '"
                        + returnType.name() + "'", node.line(), node.column());
            }

            currentReturnType = enclosingReturnType;
            loopDepth = enclosingLoopDepth;
            return null;
        }

        @Override
        public Void visitVariable(VariableDeclaration node) {
            checkVariable(node);
            return null;
        }

        @Override
        public Void visitStruct(StructDeclaration node) {
            return null;
        }

        @Override
        public Void visitUnion(UnionDeclaration node) {
            return null;
        }

        @Override
        public Void visitEnum(EnumDeclaration node) {
            for (EnumMember member : node.members()) {
                if (member.value() == null) continue;
                Type valueType = check(member.value());
                if (!valueType.isNumeric() && !valueType.isUnknown()) {
                    diagnostics.reportError("Enum value for '" + member.name() + "' must be numeric, got '"
                            + valueType.name() + "'", member.line(), member.column());
                }
            }
            return null;
        }
    }

    private class StatementChecker implements StatementVisitor<Void> {

        @Override
        public Void visitBlock(BlockStatement node) {
            checkBlock(node);
            return null;
        }

        @Override
        public Void visitReturn(ReturnStatement node) {
            if (currentReturnType == null) {
                diagnostics.reportError("Return statement outside function", node.line(), node.column());
                return null;
            }
            if (node.value() != null) {
                Type valueType = check(node.value());
                if (!currentReturnType.accepts(valueType)) {
                    diagnostics.reportError("Return type '" + valueType.name() + "' does not match function return type '"
                            + currentReturnType.name() + "'", node.line(), node.column());
                }
            } else if (currentReturnType.kind() != Type.Kind.VOID) {
                diagnostics.reportError("Function must return a value of type '" + currentReturnType.name() + "'",
                        node.line(), node.column());
            }
            return null;
        }

        @Override
        public Void visitIf(IfStatement node) {
            checkCondition(node.condition(), "If", node);
            node.consequent().accept(this);
            if (node.alternate() != null) {
                node.alternate().accept(this);
            }
            return null;
        }

        @Override
        public Void visitWhile(WhileStatement node) {
            checkCondition(node.condition(), "While", node);
            checkLoopBody(node.body());
            return null;
        }

        @Override
        public Void visitFor(ForStatement node) {
            symbolTable.enterScope();
            if (node.initializer() != null) {
                node.initializer().accept(this);
            }
            if (node.condition() != null) {
                checkCondition(node.condition(), "For", node);
            }
            if (node.increment() != null) {
                check(node.increment());
            }
            checkLoopBody(node.body());
            symbolTable.leaveScope();
            return null;
        }

        @Override
        public Void visitBreak(BreakStatement node) {
            if (loopDepth == 0) {
                diagnostics.reportError("'break' outside of loop", node.line(), node.column());
            }
            return null;
        }

        @Override
        public Void visitContinue(ContinueStatement node) {
            if (loopDepth == 0) {
                diagnostics.reportError("'continue' outside of loop", node.line(), node.column());
            }
            return null;
        }

        @Override
        public Void visitExpression(ExpressionStatement node) {
            check(node.expression());
            return null;
        }

        @Override
        public Void visitVariable(VariableDeclaration node) {
            checkVariable(node);
            return null;
        }

        @Override
        public Void visitComptime(ComptimeStatement node) {
            checkBlock(node.body());
            return null;
        }
    }

    private class ExpressionChecker implements ExpressionVisitor<Type> {

        @Override
        public Type visitBinary(BinaryExpression node) {
            Type left = check(node.left());
            Type right = check(node.right());
            String operator = node.operator();

            if (ARITHMETIC_OPERATORS.contains(operator)) {
                if (!isNumericOrUnknown(left) || !isNumericOrUnknown(right)) {
                    diagnostics.reportError("Operator '" + operator + "' requires numeric operands", node.line(), node.column());
                    return Type.UNKNOWN;
                }
                return arithmeticResult(left, right);
            }
            if (COMPARISON_OPERATORS.contains(operator)) {
                if (!left.accepts(right) && !right.accepts(left)) {
                    diagnostics.reportError("Cannot compare values of type '" + left.name() + "' and '" + right.name() + "'",
                            node.line(), node.column());
                }
                return Type.BOOL;
            }
            if (LOGICAL_OPERATORS.contains(operator)) {
                if (!isBoolOrUnknown(left) || !isBoolOrUnknown(right)) {
                    diagnostics.reportError("Operator '" + operator + "' requires boolean operands", node.line(), node.column());
                }
                return Type.BOOL;
            }
            throw new IllegalStateException("Unknown binary operator '" + operator + "'");
        }

        @Override
        public Type visitUnary(UnaryExpression node) {
            Type operand = check(node.operand());
            switch (node.operator()) {
                case "-":
                    if (!isNumericOrUnknown(operand)) {
                        diagnostics.reportError("Operator '-' requires numeric operand", node.line(), node.column());
                        return Type.UNKNOWN;
                    }
                    return operand;
                case "!":
                    if (!isBoolOrUnknown(operand)) {
                        diagnostics.reportError("Operator '!' requires boolean operand", node.line(), node.column());
                    }
                    return Type.BOOL;
                default:
                    throw new IllegalStateException("Unknown unary operator '" + node.operator() + "'");
            }
        }

        @Override
        public Type visitCall(CallExpression node) {
            Type callee = check(node.callee());
            List<Type> argumentTypes = new ArrayList<>();
            for (Expression argument : node.arguments()) {
                argumentTypes.add(check(argument));
            }

            if (callee.isUnknown()) {
                return Type.UNKNOWN;
            }
            if (callee.kind() != Type.Kind.FUNCTION) {
                diagnostics.reportError("Expression is not callable", node.line(), node.column());
                return Type.UNKNOWN;
            }

            List<Type> parameterTypes = callee.parameterTypes();
            if (argumentTypes.size() != parameterTypes.size()) {
                diagnostics.reportError("Expected " + parameterTypes.size() + " arguments, got " + argumentTypes.size(),
                        node.line(), node.column());
            }
            for (int i = 0; i < Math.min(argumentTypes.size(), parameterTypes.size()); i++) {
                Type expected = parameterTypes.get(i);
                Type actual = argumentTypes.get(i);
                if (!expected.accepts(actual)) {
                    diagnostics.reportError("Argument " + (i + 1) + ": expected '" + expected.name() + "', got '"
                            + actual.name() + "'", node.line(), node.column());
                }
            }
            return callee.returnType();
        }

        @Override
        public Type visitMemberAccess(MemberAccessExpression node) {
            Type object = typeNameOf(node.object()).orElseGet(() -> check(node.object()));
            String property = node.property();
            switch (object.kind()) {
                case UNKNOWN:
                    return Type.UNKNOWN;
                case STRUCT:
                case UNION: {
                    Type field = object.fields().get(property);
                    if (field == null) {
                        String container = object.kind() == Type.Kind.STRUCT ? "Struct" : "Union";
                        diagnostics.reportError(container + " '" + object.name() + "' has no field '" + property + "'",
                                node.line(), node.column());
                        return Type.UNKNOWN;
                    }
                    return field;
                }
                case ENUM:
                    if (!object.members().contains(property)) {
                        diagnostics.reportError("Enum '" + object.name() + "' has no member '" + property + "'",
                                node.line(), node.column());
                        return Type.UNKNOWN;
                    }
                    return object;
                default:
                    diagnostics.reportError("Type '" + object.name() + "' has no members", node.line(), node.column());
                    return Type.UNKNOWN;
            }
        }

        @Override
        public Type visitIndex(IndexExpression node) {
            check(node.object());
            Type index = check(node.index());
            if (!isNumericOrUnknown(index)) {
                diagnostics.reportError("Array index must be numeric", node.line(), node.column());
            }
            return Type.UNKNOWN;
        }

        @Override
        public Type visitIdentifier(Identifier node) {
            Optional<Symbol> symbol = symbolTable.resolve(node.name());
            if (symbol.isEmpty()) {
                diagnostics.reportError("Undefined variable '" + node.name() + "'", node.line(), node.column());
                return Type.UNKNOWN;
            }
            if (symbol.get().kind() == Symbol.Kind.TYPE) {
                diagnostics.reportError("'" + node.name() + "' is a type, not a value", node.line(), node.column());
                return Type.UNKNOWN;
            }
            return symbol.get().type();
        }

        /**
         * A type name is only valid as the object of a member access, e.g. {@code Color.red}.
         */
        private Optional<Type> typeNameOf(Expression object) {
            if (!(object instanceof Identifier identifier)) {
                return Optional.empty();
            }
            return symbolTable.resolve(identifier.name())
                    .filter(symbol -> symbol.kind() == Symbol.Kind.TYPE)
                    .map(Symbol::type);
        }

        @Override
        public Type visitNumber(NumberLiteral node) {
            return node.isFractional() ? Type.COMPTIME_FLOAT : Type.COMPTIME_INT;
        }

        @Override
        public Type visitString(StringLiteral node) {
            return Type.STRING;
        }

        @Override
        public Type visitBoolean(BooleanLiteral node) {
            return Type.BOOL;
        }

        @Override
        public Type visitStructLiteral(StructLiteral node) {
            Type type = resolveName(node.typeName());
            if (type.kind() != Type.Kind.STRUCT) {
                diagnostics.reportError("Unknown struct type '" + node.typeName() + "'", node.line(), node.column());
                for (StructLiteralField field : node.fields()) {
                    check(field.value());
                }
                return Type.UNKNOWN;
            }
            for (StructLiteralField field : node.fields()) {
                Type actual = check(field.value());
                Type expected = type.fields().get(field.name());
                if (expected == null) {
                    diagnostics.reportError("Struct '" + type.name() + "' has no field '" + field.name() + "'",
                            field.line(), field.column());
                } else if (!expected.accepts(actual)) {
                    diagnostics.reportError("Field '" + field.name() + "': expected '" + expected.name() + "', got '"
                            + actual.name() + "'", field.line(), field.column());
                }
            }
            return type;
        }

        @Override
        public Type visitArrayLiteral(ArrayLiteral node) {
            for (Expression element : node.elements()) {
                check(element);
            }
            return Type.UNKNOWN;
        }

        @Override
        public Type visitAssignment(AssignmentExpression node) {
            Type target = check(node.left());
            Type value = check(node.right());

            Expression left = node.left();
            if (left instanceof Identifier identifier) {
                symbolTable.resolve(identifier.name())
                        .filter(Symbol::isConst)
                        .ifPresent(symbol -> diagnostics.reportError(
                                "Cannot assign to const variable '" + identifier.name() + "'", node.line(), node.column()));
            } else if (!(left instanceof MemberAccessExpression) && !(left instanceof IndexExpression)) {
                diagnostics.reportError("Invalid assignment target", node.line(), node.column());
                return Type.UNKNOWN;
            }

            if ("+=".equals(node.operator())) {
                if (!isNumericOrUnknown(target) || !isNumericOrUnknown(value)) {
                    diagnostics.reportError("Operator '+=' requires numeric operands", node.line(), node.column());
                    return target;
                }
            }
            if (!target.accepts(value)) {
                diagnostics.reportError("Cannot assign value of type '" + value.name() + "' to '" + target.name() + "'",
                        node.line(), node.column());
            }
            return target;
        }

        private boolean isNumericOrUnknown(Type type) {
            return type.isNumeric() || type.isUnknown();
        }

        private boolean isBoolOrUnknown(Type type) {
            return type.isBool() || type.isUnknown();
        }

        private Type arithmeticResult(Type left, Type right) {
            if (left.isUnknown() || right.isUnknown()) {
                return Type.UNKNOWN;
            }
            if (left.isComptimeNumber() && right.isComptimeNumber()) {
                return left == Type.COMPTIME_FLOAT || right == Type.COMPTIME_FLOAT ? Type.COMPTIME_FLOAT : Type.COMPTIME_INT;
            }
            return left.isComptimeNumber() ? right : left;
        }
    }

    private class TypeResolver implements TypeAnnotationVisitor<Type> {

        @Override
        public Type visitPrimitive(PrimitiveType node) {
            return Type.primitive(node.name());
        }

        @Override
        public Type visitNamed(NamedType node) {
            return symbolTable.resolve(node.name())
                    .filter(symbol -> symbol.kind() == Symbol.Kind.TYPE)
                    .map(Symbol::type)
                    .orElse(Type.unresolved(node.name()));
        }

        @Override
        public Type visitPointer(PointerType node) {
            return Type.unresolved("*" + node.pointeeType().accept(this).name());
        }

        @Override
        public Type visitArray(ArrayType node) {
            String size = node.size() == null ? "" : node.size().toString();
            return Type.unresolved("[" + size + "]" + node.elementType().accept(this).name());
        }

        @Override
        public Type visitErrorUnion(ErrorUnionType node) {
            return node.valueType().accept(this);
        }

        @Override
        public Type visitOptional(OptionalType node) {
            return Type.unresolved("?" + node.valueType().accept(this).name());
        }
    }
}
