package org.typeweave.compiler.macro;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Creates synthesized expression nodes with well-formed text.
 */
public class NodeFactory {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public SyntaxNode identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid identifier: " + name);
        }
        return SyntaxNode.synthetic(NodeKind.IDENTIFIER, name);
    }

    /**
     * @param value The literal value; quotes and control characters are escaped.
     */
    public SyntaxNode stringLiteral(String value) {
        return SyntaxNode.synthetic(NodeKind.STRING_LITERAL, GSON.toJson(value));
    }

    public SyntaxNode numericLiteral(long value) {
        return SyntaxNode.synthetic(NodeKind.NUMERIC_LITERAL, Long.toString(value));
    }

    public SyntaxNode numericLiteral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Not a finite numeric literal: " + value);
        }
        return SyntaxNode.synthetic(NodeKind.NUMERIC_LITERAL, BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
    }

    public SyntaxNode booleanLiteral(boolean value) {
        return SyntaxNode.synthetic(NodeKind.BOOLEAN_LITERAL, Boolean.toString(value));
    }

    public SyntaxNode call(String callee, List<SyntaxNode> arguments) {
        return SyntaxNode.synthetic(NodeKind.CALL, callee + "(" + join(arguments) + ")");
    }

    public SyntaxNode call(String callee, SyntaxNode... arguments) {
        return call(callee, List.of(arguments));
    }

    public SyntaxNode arrayLiteral(List<SyntaxNode> elements) {
        return SyntaxNode.synthetic(NodeKind.ARRAY_LITERAL, "[" + join(elements) + "]");
    }

    /**
     * @param properties Property names to values, in output order. Names that are not identifiers are quoted.
     */
    public SyntaxNode objectLiteral(Map<String, SyntaxNode> properties) {
        List<String> entries = new ArrayList<>(properties.size());
        for (Map.Entry<String, SyntaxNode> entry : new LinkedHashMap<>(properties).entrySet()) {
            String key = IDENTIFIER.matcher(entry.getKey()).matches() ? entry.getKey() : GSON.toJson(entry.getKey());
            entries.add(key + ": " + entry.getValue().text());
        }
        return SyntaxNode.synthetic(NodeKind.OBJECT_LITERAL, entries.isEmpty() ? "{}" : "{ " + String.join(", ", entries) + " }");
    }

    public SyntaxNode expression(String text) {
        return SyntaxNode.synthetic(NodeKind.EXPRESSION, text);
    }

    private static String join(List<SyntaxNode> nodes) {
        List<String> parts = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            parts.add(node.text());
        }
        return String.join(", ", parts);
    }
}
