package org.typeweave.compiler.check;

import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.host.SourceFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A type checker that answers queries from declarations only.
 * <p>
 * It indexes interface members, object-typed aliases, variable declarations (annotated, or typed by a
 * literal, constructor call or another typed expression in their initializer) and function return types.
 * Expressions are typed structurally: literals, names, calls of declared functions, constructor calls and
 * property access chains. Anything else is {@link ITypeChecker#UNKNOWN}.
 */
public class DeclaredTypeChecker implements ITypeChecker {

    private static final int MAX_RESOLUTION_DEPTH = 16;

    private record Variable(String type, String initializer) {
    }

    private final Map<String, List<PropertyInfo>> objectTypes = new LinkedHashMap<>();
    private final Map<String, String> functionReturnTypes = new HashMap<>();
    private final Map<String, Map<String, Variable>> variablesByFile = new HashMap<>();
    private final Map<String, Variable> globalVariables = new HashMap<>();

    public DeclaredTypeChecker(Collection<SourceFile> files) {
        for (SourceFile file : files) {
            index(file);
        }
    }

    @Override
    public String typeOfExpression(String fileName, String expression) {
        return typeOf(fileName, expression, 0);
    }

    @Override
    public List<PropertyInfo> getPropertiesOfType(String typeName) {
        return objectTypes.getOrDefault(baseName(typeName), List.of());
    }

    @Override
    public boolean isKnownType(String typeName) {
        return objectTypes.containsKey(baseName(typeName));
    }

    private void index(SourceFile file) {
        TokenStream stream = TokenStream.of(file.text(), ScannerOptions.forFile(List.of(), file.fileName()));
        Map<String, Variable> fileVariables = variablesByFile.computeIfAbsent(file.fileName(), k -> new HashMap<>());
        for (int i = 0; i < stream.size(); i++) {
            Token token = stream.get(i);
            Token previous = stream.get(i - 1);
            if (previous != null && (previous.is(TokenKind.DOT) || previous.is(TokenKind.QUESTION_DOT))) {
                continue;
            }
            Token name = stream.get(i + 1);
            if (name == null || !name.is(TokenKind.IDENTIFIER)) {
                continue;
            }
            switch (token.kind()) {
                case INTERFACE -> indexInterface(stream, i + 1);
                case TYPE -> indexAlias(stream, i + 1);
                case CONST, LET, VAR -> indexVariable(stream, i + 1, fileVariables);
                case FUNCTION -> indexFunction(stream, i + 1);
                default -> {
                }
            }
        }
    }

    private void indexInterface(TokenStream stream, int nameIndex) {
        int j = skipTypeParameters(stream, nameIndex + 1);
        while (stream.get(j) != null && !stream.get(j).is(TokenKind.OPEN_BRACE)) {
            j++;
        }
        if (stream.get(j) == null) {
            return;
        }
        List<PropertyInfo> members = parseMembers(stream, j);
        objectTypes.merge(stream.get(nameIndex).text(), members, (existing, added) -> {
            List<PropertyInfo> merged = new ArrayList<>(existing);
            merged.addAll(added);
            return merged;
        });
    }

    private void indexAlias(TokenStream stream, int nameIndex) {
        int j = skipTypeParameters(stream, nameIndex + 1);
        Token equals = stream.get(j);
        Token open = stream.get(j + 1);
        if (equals != null && equals.is(TokenKind.EQUALS) && open != null && open.is(TokenKind.OPEN_BRACE)) {
            objectTypes.putIfAbsent(stream.get(nameIndex).text(), parseMembers(stream, j + 1));
        }
    }

    private void indexVariable(TokenStream stream, int nameIndex, Map<String, Variable> fileVariables) {
        String name = stream.get(nameIndex).text();
        int j = nameIndex + 1;
        String type = null;
        if (stream.get(j) != null && stream.get(j).is(TokenKind.COLON)) {
            int end = findTypeEnd(stream, j + 1, true);
            if (end > j + 1) {
                type = normalize(stream.textBetween(j + 1, end - 1));
            }
            j = end;
        }
        String initializer = null;
        if (stream.get(j) != null && stream.get(j).is(TokenKind.EQUALS) && stream.get(j + 1) != null) {
            int end = findExpressionEnd(stream, j + 1);
            if (end > j + 1) {
                initializer = stream.textBetween(j + 1, end - 1);
            }
        }
        Variable variable = new Variable(type, initializer);
        fileVariables.putIfAbsent(name, variable);
        globalVariables.putIfAbsent(name, variable);
    }

    private void indexFunction(TokenStream stream, int nameIndex) {
        int j = skipTypeParameters(stream, nameIndex + 1);
        if (stream.get(j) == null || !stream.get(j).is(TokenKind.OPEN_PAREN)) {
            return;
        }
        int close = stream.findMatchingClose(j);
        if (close < 0 || stream.get(close + 1) == null || !stream.get(close + 1).is(TokenKind.COLON)) {
            return;
        }
        int end = findTypeEnd(stream, close + 2, false);
        if (end > close + 2) {
            functionReturnTypes.putIfAbsent(stream.get(nameIndex).text(), normalize(stream.textBetween(close + 2, end - 1)));
        }
    }

    /**
     * Parses the members of an object type body.
     * @param openIndex Index of the opening brace.
     */
    private List<PropertyInfo> parseMembers(TokenStream stream, int openIndex) {
        List<PropertyInfo> members = new ArrayList<>();
        int close = stream.findMatchingClose(openIndex);
        if (close < 0) {
            return members;
        }
        int i = openIndex + 1;
        while (i < close) {
            Token t = stream.get(i);
            if (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA)
                    || (t.is(TokenKind.KEYWORD) && t.text().equals("readonly"))) {
                i++;
                continue;
            }
            if (!(t.is(TokenKind.IDENTIFIER) || t.is(TokenKind.STRING) || t.kind().isKeyword())) {
                i = skipMember(stream, i, close);
                continue;
            }
            String name = t.is(TokenKind.STRING) ? t.text().substring(1, t.text().length() - 1) : t.text();
            int j = i + 1;
            boolean optional = false;
            if (stream.get(j).is(TokenKind.QUESTION)) {
                optional = true;
                j++;
            }
            boolean method = false;
            if (stream.get(j).is(TokenKind.LESS_THAN)) {
                int angle = stream.findMatchingAngle(j);
                j = angle < 0 ? j : angle + 1;
            }
            if (stream.get(j).is(TokenKind.OPEN_PAREN)) {
                int paren = stream.findMatchingClose(j);
                if (paren < 0 || paren >= close) {
                    break;
                }
                method = true;
                j = paren + 1;
            }
            if (j < close && stream.get(j).is(TokenKind.COLON)) {
                int end = Math.min(findMemberTypeEnd(stream, j + 1, close), close);
                String type = end > j + 1 ? normalize(stream.textBetween(j + 1, end - 1)) : UNKNOWN;
                members.add(new PropertyInfo(name, type, optional, method));
                i = end;
            } else {
                members.add(new PropertyInfo(name, method ? "void" : UNKNOWN, optional, method));
                i = skipMember(stream, j, close);
            }
        }
        return members;
    }

    private static int skipMember(TokenStream stream, int from, int close) {
        int depth = 0;
        for (int i = from; i < close; i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t)) {
                depth--;
            } else if (depth == 0 && (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA))) {
                return i + 1;
            }
        }
        return close;
    }

    /**
     * A member type ends at a top-level separator or at a line break that is not continued by a type operator.
     */
    private static int findMemberTypeEnd(TokenStream stream, int from, int close) {
        int depth = 0;
        String source = stream.source();
        for (int i = from; i < close; i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t) || t.is(TokenKind.LESS_THAN)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t) || t.is(TokenKind.GREATER_THAN)) {
                depth--;
            } else if (depth == 0 && (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA))) {
                return i;
            }
            if (depth == 0 && i > from) {
                Token previous = stream.get(i - 1);
                boolean newline = source.substring(previous.end(), t.start()).indexOf('\n') >= 0;
                boolean continued = previous.is(TokenKind.BAR) || previous.is(TokenKind.AMPERSAND)
                        || previous.is(TokenKind.ARROW) || t.is(TokenKind.BAR) || t.is(TokenKind.AMPERSAND);
                if (newline && !continued && !TokenStream.isCloseBracket(t) && !t.is(TokenKind.GREATER_THAN)) {
                    return i;
                }
            }
        }
        return close;
    }

    /**
     * @param stopAtBrace true to end the type at a top-level {@code =}; false for return types, which end
     *                    at a body brace or {@code =>}.
     * @return The index of the first token after the type.
     */
    private static int findTypeEnd(TokenStream stream, int from, boolean stopAtBrace) {
        int depth = 0;
        for (int i = from; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (depth == 0) {
                if (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA)
                        || (t.is(TokenKind.EQUALS) && stopAtBrace)
                        || (!stopAtBrace && i > from && t.is(TokenKind.OPEN_BRACE))) {
                    return i;
                }
            }
            if (TokenStream.isOpenBracket(t) || t.is(TokenKind.LESS_THAN)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t) || t.is(TokenKind.GREATER_THAN)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return stream.size();
    }

    private static int findExpressionEnd(TokenStream stream, int from) {
        int depth = 0;
        for (int i = from; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA))) {
                return i;
            }
        }
        return stream.size();
    }

    private static int skipTypeParameters(TokenStream stream, int index) {
        Token t = stream.get(index);
        if (t != null && t.is(TokenKind.LESS_THAN)) {
            int close = stream.findMatchingAngle(index);
            return close < 0 ? index : close + 1;
        }
        return index;
    }

    private String typeOf(String fileName, String expression, int depth) {
        if (expression == null || depth > MAX_RESOLUTION_DEPTH) {
            return UNKNOWN;
        }
        TokenStream stream = TokenStream.of(expression.strip(), ScannerOptions.forFile(List.of(), fileName));
        int size = stream.size();
        if (size == 0) {
            return UNKNOWN;
        }
        if (stream.get(0).is(TokenKind.OPEN_PAREN) && stream.findMatchingClose(0) == size - 1) {
            return typeOf(fileName, stream.textBetween(1, size - 2), depth + 1);
        }
        Token first = stream.get(0);
        if (size == 1) {
            return switch (first.kind()) {
                case NUMBER -> "number";
                case STRING, NO_SUBSTITUTION_TEMPLATE -> "string";
                case REGEX -> "RegExp";
                case KEYWORD -> switch (first.text()) {
                    case "true", "false" -> "boolean";
                    case "null" -> "null";
                    default -> UNKNOWN;
                };
                case IDENTIFIER -> first.text().equals("undefined") ? "undefined" : typeOfName(fileName, first.text(), depth);
                default -> UNKNOWN;
            };
        }
        if (first.is(TokenKind.TEMPLATE_HEAD) && stream.findMatchingClose(0) == size - 1) {
            return "string";
        }
        if (first.is(TokenKind.NEW) && stream.get(1).is(TokenKind.IDENTIFIER)) {
            int j = 2;
            if (stream.get(j) != null && stream.get(j).is(TokenKind.LESS_THAN)) {
                int close = stream.findMatchingAngle(j);
                return close < 0 ? stream.get(1).text() : stream.textBetween(1, close);
            }
            return stream.get(1).text();
        }
        if (first.is(TokenKind.IDENTIFIER) && stream.get(1).is(TokenKind.OPEN_PAREN)
                && stream.findMatchingClose(1) == size - 1) {
            return functionReturnTypes.getOrDefault(first.text(), UNKNOWN);
        }
        if (first.is(TokenKind.OPEN_BRACKET) && stream.findMatchingClose(0) == size - 1) {
            return "unknown[]";
        }
        if (first.is(TokenKind.OPEN_BRACE) && stream.findMatchingClose(0) == size - 1) {
            return "object";
        }
        if (isAccessChain(stream)) {
            String type = typeOfName(fileName, first.text(), depth);
            for (int i = 2; i < size && !UNKNOWN.equals(type); i += 2) {
                type = propertyType(type, stream.get(i).text());
            }
            return type;
        }
        return UNKNOWN;
    }

    private String typeOfName(String fileName, String name, int depth) {
        Variable variable = variablesByFile.getOrDefault(fileName, Map.of()).get(name);
        if (variable == null) {
            variable = globalVariables.get(name);
        }
        if (variable == null) {
            return UNKNOWN;
        }
        return variable.type() != null ? variable.type() : typeOf(fileName, variable.initializer(), depth + 1);
    }

    private String propertyType(String ownerType, String member) {
        for (PropertyInfo property : getPropertiesOfType(ownerType)) {
            if (property.name().equals(member)) {
                return property.type();
            }
        }
        return UNKNOWN;
    }

    private static boolean isAccessChain(TokenStream stream) {
        if (stream.size() < 3 || stream.size() % 2 == 0) {
            return false;
        }
        for (int i = 0; i < stream.size(); i++) {
            Token t = stream.get(i);
            boolean expected = i % 2 == 0 ? t.is(TokenKind.IDENTIFIER) : t.is(TokenKind.DOT) || t.is(TokenKind.QUESTION_DOT);
            if (!expected) {
                return false;
            }
        }
        return true;
    }

    private static String baseName(String typeName) {
        String trimmed = typeName.strip();
        int angle = trimmed.indexOf('<');
        return angle < 0 ? trimmed : trimmed.substring(0, angle).strip();
    }

    private static String normalize(String typeText) {
        return typeText.strip().replaceAll("\\s+", " ");
    }
}
