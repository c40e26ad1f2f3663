package org.zignet.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A type as seen by the {@link TypeChecker}.
 * <p>
 * Types are compared by name. Container types (struct, union, enum) are created empty and
 * filled once all container names are known, so fields may refer to containers declared
 * later in the file.
 */
public final class Type {

    /**
     * The category of a type.
     */
    public enum Kind {
        PRIMITIVE,
        STRUCT,
        UNION,
        ENUM,
        FUNCTION,
        VOID,
        UNKNOWN
    }

    public static final Type VOID = new Type(Kind.VOID, "void", List.of(), null);
    public static final Type UNKNOWN = new Type(Kind.UNKNOWN, "unknown", List.of(), null);
    public static final Type BOOL = primitive("bool");
    public static final Type STRING = primitive("string");
    public static final Type COMPTIME_INT = primitive("comptime_int");
    public static final Type COMPTIME_FLOAT = primitive("comptime_float");

    private static final Set<String> INTEGER_NAMES = Set.of("i32", "i64", "u32");
    private static final Set<String> FLOAT_NAMES = Set.of("f32", "f64");

    private final Kind kind;
    private final String name;
    private final Map<String, Type> fields = new LinkedHashMap<>();
    private final Set<String> members = new LinkedHashSet<>();
    private final List<Type> parameterTypes;
    private final Type returnType;

    private Type(Kind kind, String name, List<Type> parameterTypes, Type returnType) {
        this.kind = kind;
        this.name = name;
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnType = returnType;
    }

    public static Type primitive(String name) {
        return "void".equals(name) ? VOID : new Type(Kind.PRIMITIVE, name, List.of(), null);
    }

    /**
     * Creates the placeholder for a named type that does not resolve. It behaves like
     * {@link #UNKNOWN} but keeps the written name for messages.
     * @param name The written type name.
     * @return An unknown type carrying the name.
     */
    public static Type unresolved(String name) {
        return new Type(Kind.UNKNOWN, name, List.of(), null);
    }

    public static Type struct(String name) {
        return new Type(Kind.STRUCT, name, List.of(), null);
    }

    public static Type union(String name) {
        return new Type(Kind.UNION, name, List.of(), null);
    }

    public static Type enumeration(String name) {
        return new Type(Kind.ENUM, name, List.of(), null);
    }

    /**
     * Creates a function type. Its name is the signature, e.g. {@code fn(i32, i32) i32}.
     * @param parameterTypes The parameter types in order.
     * @param returnType The return type.
     * @return The function type.
     */
    public static Type function(List<Type> parameterTypes, Type returnType) {
        StringBuilder signature = new StringBuilder("fn(");
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) signature.append(", ");
            signature.append(parameterTypes.get(i).name());
        }
        signature.append(") ").append(returnType.name());
        return new Type(Kind.FUNCTION, signature.toString(), parameterTypes, returnType);
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    /**
     * @return The fields of a struct or union in declaration order; empty for other kinds.
     */
    public Map<String, Type> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * @return The member names of an enum in declaration order; empty for other kinds.
     */
    public Set<String> members() {
        return Collections.unmodifiableSet(members);
    }

    public List<Type> parameterTypes() {
        return parameterTypes;
    }

    /**
     * @return The return type of a function, or {@code null} for other kinds.
     */
    public Type returnType() {
        return returnType;
    }

    /**
     * Adds a field to a struct or union.
     * @return {@code false} if a field with this name already exists.
     */
    boolean addField(String fieldName, Type fieldType) {
        if (kind != Kind.STRUCT && kind != Kind.UNION) {
            throw new IllegalStateException("Type '" + name + "' cannot have fields");
        }
        return fields.putIfAbsent(fieldName, fieldType) == null;
    }

    /**
     * Adds a member to an enum.
     * @return {@code false} if a member with this name already exists.
     */
    boolean addMember(String memberName) {
        if (kind != Kind.ENUM) {
            throw new IllegalStateException("Type '" + name + "' cannot have members");
        }
        return members.add(memberName);
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    public boolean isBool() {
        return kind == Kind.PRIMITIVE && "bool".equals(name);
    }

    public boolean isComptimeNumber() {
        return this == COMPTIME_INT || this == COMPTIME_FLOAT;
    }

    public boolean isNumeric() {
        return kind == Kind.PRIMITIVE
                && (INTEGER_NAMES.contains(name) || FLOAT_NAMES.contains(name) || isComptimeNumber());
    }

    /**
     * Checks whether a value of type {@code actual} may be stored where this type is expected.
     * Unknown types on either side are accepted so that one error does not cascade.
     * @param actual The type of the value.
     * @return {@code true} if the value fits.
     */
    public boolean accepts(Type actual) {
        if (isUnknown() || actual.isUnknown()) {
            return true;
        }
        if (actual == COMPTIME_INT) {
            return isNumeric();
        }
        if (actual == COMPTIME_FLOAT) {
            return this == COMPTIME_FLOAT || FLOAT_NAMES.contains(name);
        }
        return kind == actual.kind && name.equals(actual.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Type other)) return false;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
