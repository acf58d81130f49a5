package org.typeweave.compiler.host;

import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.frontend.lexer.CustomOperatorDef;
import org.typeweave.compiler.frontend.lexer.ScanError;
import org.typeweave.compiler.frontend.lexer.Scanner;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Decides whether text is acceptable to the host parser.
 * <p>
 * The check is lexical and structural: scan errors, unbalanced or mismatched brackets, operator symbols
 * the host grammar does not know, kind markers ({@code F<_>}) and decorators in positions the host
 * grammar rejects. It is what the virtual host uses to decide whether a file needs preprocessing and to
 * verify the preprocessed output.
 */
public class SyntaxValidator {

    public static final String PHASE = "parse";

    private final List<CustomOperatorDef> extendedOperators;

    public SyntaxValidator() {
        this(ScannerOptions.DEFAULT_CUSTOM_OPERATORS);
    }

    /**
     * @param extendedOperators The operator symbols of the extended syntax; those the host grammar does not
     *                          know are reported as errors.
     */
    public SyntaxValidator(List<CustomOperatorDef> extendedOperators) {
        this.extendedOperators = List.copyOf(extendedOperators);
    }

    /**
     * Validates a whole file.
     * @param text     The text.
     * @param fileName The file name, also used to pick the grammar variant.
     * @return The syntax errors, empty if the text is valid.
     */
    public List<Diagnostic> validate(String text, String fileName) {
        Scanner scanner = new Scanner(text, ScannerOptions.forFile(extendedOperators, fileName));
        List<Token> tokens = scanner.scanTokens();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ScanError error : scanner.getErrors()) {
            diagnostics.add(error(error.message(), fileName, error.start(), error.end() - error.start()));
        }
        checkBrackets(tokens, fileName, text.length(), diagnostics);
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isCustomOperator() && !Scanner.isNativePunctuator(token.text())) {
                diagnostics.add(error("Unexpected operator '" + token.text() + "'", fileName,
                        token.start(), token.end() - token.start()));
            } else if (isKindMarker(tokens, i)) {
                diagnostics.add(error("Kind annotation '" + token.text() + "<_>' is not valid here", fileName,
                        token.start(), tokens.get(i + 1).end() - token.start()));
            } else if (token.is(TokenKind.AT)) {
                checkDecorator(tokens, i, fileName, diagnostics);
            }
        }
        return diagnostics;
    }

    public boolean isValid(String text, String fileName) {
        return validate(text, fileName).isEmpty();
    }

    /**
     * Validates a code fragment that must form exactly one expression.
     * @param code The fragment.
     * @return The problems found, empty if the fragment is a well-formed expression.
     */
    public List<Diagnostic> validateExpression(String code) {
        String fileName = "<expression>";
        if (code == null || code.isBlank()) {
            return List.of(error("Expected an expression", fileName, 0, 0));
        }
        List<Diagnostic> diagnostics = new ArrayList<>(validate(code, fileName));
        List<Token> tokens = Scanner.tokenize(code, ScannerOptions.forFile(extendedOperators, fileName));
        if (!tokens.isEmpty() && isStatementStart(tokens.get(0))) {
            diagnostics.add(error("Expected an expression but found '" + tokens.get(0).text() + "'",
                    fileName, tokens.get(0).start(), tokens.get(0).text().length()));
        }
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (isOpen(t)) {
                depth++;
            } else if (isClose(t)) {
                depth--;
            } else if (depth == 0 && t.is(TokenKind.SEMICOLON) && i != tokens.size() - 1) {
                diagnostics.add(error("Expected a single expression", fileName, t.start(), 1));
                break;
            }
        }
        return diagnostics;
    }

    /**
     * Validates a code fragment that forms a statement list.
     */
    public List<Diagnostic> validateStatements(String code) {
        return validate(code == null ? "" : code, "<statements>");
    }

    private static void checkBrackets(List<Token> tokens, String fileName, int length, List<Diagnostic> out) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token t : tokens) {
            if (isOpen(t)) {
                open.push(t);
            } else if (t.is(TokenKind.TEMPLATE_MIDDLE)) {
                if (open.isEmpty() || !open.peek().is(TokenKind.TEMPLATE_HEAD)) {
                    out.add(error("Unexpected template continuation", fileName, t.start(), t.end() - t.start()));
                    return;
                }
            } else if (isClose(t)) {
                if (open.isEmpty()) {
                    out.add(error("Unexpected '" + closingText(t) + "'", fileName, t.start(), 1));
                    return;
                }
                Token opener = open.pop();
                if (expectedCloser(opener) != t.kind()) {
                    out.add(error("Expected '" + closingText(expectedCloser(opener)) + "' to match '"
                            + opener.text().charAt(opener.text().length() - 1) + "' at " + opener.start(),
                            fileName, t.start(), 1));
                    return;
                }
            }
        }
        if (!open.isEmpty()) {
            Token opener = open.peek();
            out.add(error("Missing '" + closingText(expectedCloser(opener)) + "' for bracket opened at "
                    + opener.start(), fileName, length, 0));
        }
    }

    private static boolean isKindMarker(List<Token> tokens, int i) {
        if (i + 3 >= tokens.size() || !tokens.get(i).is(TokenKind.IDENTIFIER) || !tokens.get(i + 1).is(TokenKind.LESS_THAN)) {
            return false;
        }
        Token inner = tokens.get(i + 2);
        return inner.is(TokenKind.IDENTIFIER) && inner.text().equals("_")
                && (tokens.get(i + 3).is(TokenKind.GREATER_THAN) || tokens.get(i + 3).is(TokenKind.COMMA));
    }

    /**
     * Decorators are accepted on classes and class members only.
     */
    private static void checkDecorator(List<Token> tokens, int atIndex, String fileName, List<Diagnostic> out) {
        int j = atIndex + 1;
        if (j >= tokens.size() || !tokens.get(j).is(TokenKind.IDENTIFIER)) {
            return;
        }
        j++;
        if (j < tokens.size() && tokens.get(j).is(TokenKind.OPEN_PAREN)) {
            int depth = 0;
            for (; j < tokens.size(); j++) {
                if (tokens.get(j).is(TokenKind.OPEN_PAREN)) {
                    depth++;
                } else if (tokens.get(j).is(TokenKind.CLOSE_PAREN) && --depth == 0) {
                    j++;
                    break;
                }
            }
        }
        while (j < tokens.size() && tokens.get(j).is(TokenKind.EXPORT)) {
            j++;
        }
        if (j >= tokens.size()) {
            return;
        }
        TokenKind target = tokens.get(j).kind();
        if (target == TokenKind.CONST || target == TokenKind.LET || target == TokenKind.VAR
                || target == TokenKind.INTERFACE) {
            Token at = tokens.get(atIndex);
            out.add(error("Decorators are not valid on '" + tokens.get(j).text() + "' declarations", fileName,
                    at.start(), tokens.get(atIndex + 1).end() - at.start()));
        }
    }

    private static boolean isStatementStart(Token token) {
        return switch (token.kind()) {
            case CONST, LET, VAR, RETURN, THROW, TYPE, INTERFACE, ENUM, IMPORT, EXPORT, DECLARE, NAMESPACE -> true;
            default -> false;
        };
    }

    private static boolean isOpen(Token t) {
        return t.is(TokenKind.OPEN_PAREN) || t.is(TokenKind.OPEN_BRACE) || t.is(TokenKind.OPEN_BRACKET)
                || t.is(TokenKind.TEMPLATE_HEAD);
    }

    private static boolean isClose(Token t) {
        return t.is(TokenKind.CLOSE_PAREN) || t.is(TokenKind.CLOSE_BRACE) || t.is(TokenKind.CLOSE_BRACKET)
                || t.is(TokenKind.TEMPLATE_TAIL);
    }

    private static TokenKind expectedCloser(Token opener) {
        return switch (opener.kind()) {
            case OPEN_PAREN -> TokenKind.CLOSE_PAREN;
            case OPEN_BRACKET -> TokenKind.CLOSE_BRACKET;
            case TEMPLATE_HEAD -> TokenKind.TEMPLATE_TAIL;
            default -> TokenKind.CLOSE_BRACE;
        };
    }

    private static String closingText(Token closer) {
        return closingText(closer.kind());
    }

    private static String closingText(TokenKind kind) {
        return switch (kind) {
            case CLOSE_PAREN -> ")";
            case CLOSE_BRACKET -> "]";
            case TEMPLATE_TAIL -> "}`";
            default -> "}";
        };
    }

    private static Diagnostic error(String message, String fileName, int start, int length) {
        return new Diagnostic(Diagnostic.Severity.ERROR, message, fileName, start, length, PHASE);
    }
}
