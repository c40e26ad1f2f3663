package org.zignet.compiler.util;

import org.zignet.compiler.frontend.parser.ast.AstNode;
import org.zignet.compiler.frontend.parser.ast.Declaration;
import org.zignet.compiler.frontend.parser.ast.Identifier;
import org.zignet.compiler.frontend.parser.ast.NumberLiteral;
import org.zignet.compiler.frontend.parser.ast.Parameter;
import org.zignet.compiler.frontend.parser.ast.PrimitiveType;
import org.zignet.compiler.frontend.parser.ast.NamedType;
import org.zignet.compiler.frontend.parser.ast.BinaryExpression;
import org.zignet.compiler.frontend.parser.ast.UnaryExpression;
import org.zignet.compiler.frontend.parser.ast.AssignmentExpression;
import org.zignet.compiler.frontend.parser.ast.MemberAccessExpression;
import org.zignet.compiler.frontend.parser.ast.StringLiteral;
import org.zignet.compiler.frontend.parser.ast.BooleanLiteral;
import org.zignet.compiler.frontend.parser.ast.ContainerField;
import org.zignet.compiler.frontend.parser.ast.EnumMember;

/**
 * Utility class for dumping a syntax tree as an indented outline, one node per line.
 */
public final class AstDump {

	private AstDump() {}

	/**
	 * Dumps a tree in pre-order. Each line holds the node kind, its most telling attribute and its position.
	 * @param root The node to start from, usually a {@code Program}.
	 * @return The outline, ending with a newline.
	 */
	public static String dump(AstNode root) {
		StringBuilder sb = new StringBuilder();
		append(sb, root, 0);
		return sb.toString();
	}

	private static void append(StringBuilder sb, AstNode node, int depth) {
		sb.append("  ".repeat(depth)).append(node.getClass().getSimpleName());
		String label = label(node);
		if (label != null) sb.append(' ').append(label);
		sb.append(" @").append(node.line()).append(':').append(node.column()).append('\n');
		for (AstNode child : node.getChildren()) {
			append(sb, child, depth + 1);
		}
	}

	private static String label(AstNode node) {
		if (node instanceof Declaration d) return d.name();
		if (node instanceof Parameter p) return p.name();
		if (node instanceof ContainerField f) return f.name();
		if (node instanceof EnumMember m) return m.name();
		if (node instanceof Identifier i) return i.name();
		if (node instanceof NumberLiteral n) return n.value().toPlainString();
		if (node instanceof StringLiteral s) return '"' + s.value() + '"';
		if (node instanceof BooleanLiteral b) return Boolean.toString(b.value());
		if (node instanceof BinaryExpression b) return b.operator();
		if (node instanceof UnaryExpression u) return u.operator();
		if (node instanceof AssignmentExpression a) return a.operator();
		if (node instanceof MemberAccessExpression m) return "." + m.property();
		if (node instanceof PrimitiveType t) return t.name();
		if (node instanceof NamedType t) return t.name();
		return null;
	}
}
