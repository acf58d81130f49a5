package org.typeweave.compiler.frontend.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Map.entry;
import static org.typeweave.compiler.frontend.lexer.TokenKind.*;

/**
 * Tokenizes host-language source text.
 * <p>
 * Whitespace and comments are skipped. Registered custom operator symbols are produced as
 * single {@link TokenKind#CUSTOM_OPERATOR} tokens, even when the host grammar would split them
 * into several punctuators (a custom {@code |>} is never scanned as {@code |} followed by {@code >}).
 * A custom symbol only loses against a strictly longer built-in punctuator, so registering
 * {@code +} does not break {@code ++} or {@code +=}.
 * <p>
 * {@code >} is always scanned as a single token so that nested generic closers such as
 * {@code Array<Array<T>>} stay balanced. Lexical problems are collected as {@link ScanError}s;
 * scanning never throws.
 */
public class Scanner {

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
            entry("const", CONST), entry("let", LET), entry("var", VAR),
            entry("return", RETURN), entry("throw", THROW), entry("yield", YIELD),
            entry("case", CASE), entry("default", DEFAULT),
            entry("type", TYPE), entry("interface", INTERFACE), entry("class", CLASS),
            entry("function", FUNCTION), entry("enum", ENUM), entry("namespace", NAMESPACE),
            entry("declare", DECLARE), entry("import", IMPORT), entry("export", EXPORT),
            entry("from", FROM), entry("extends", EXTENDS), entry("implements", IMPLEMENTS),
            entry("new", NEW), entry("typeof", TYPEOF), entry("keyof", KEYOF), entry("as", AS),
            entry("in", IN), entry("instanceof", INSTANCEOF),
            entry("if", KEYWORD), entry("else", KEYWORD), entry("for", KEYWORD), entry("while", KEYWORD),
            entry("do", KEYWORD), entry("switch", KEYWORD), entry("break", KEYWORD), entry("continue", KEYWORD),
            entry("try", KEYWORD), entry("catch", KEYWORD), entry("finally", KEYWORD), entry("this", KEYWORD),
            entry("super", KEYWORD), entry("null", KEYWORD), entry("true", KEYWORD), entry("false", KEYWORD),
            entry("void", KEYWORD), entry("delete", KEYWORD), entry("await", KEYWORD), entry("async", KEYWORD),
            entry("of", KEYWORD), entry("readonly", KEYWORD), entry("public", KEYWORD), entry("private", KEYWORD),
            entry("protected", KEYWORD), entry("static", KEYWORD), entry("abstract", KEYWORD),
            entry("debugger", KEYWORD), entry("with", KEYWORD), entry("satisfies", KEYWORD), entry("is", KEYWORD),
            entry("infer", KEYWORD), entry("unique", KEYWORD), entry("module", KEYWORD));

    /** Keywords after which a value, not a regex, has just ended. */
    private static final List<String> VALUE_KEYWORDS = List.of("this", "super", "null", "true", "false");

    private static final List<String> COMPOSED_GREATER_THAN = List.of(">=", ">>", ">>=", ">>>", ">>>=");

    private static final Map<String, TokenKind> PUNCTUATORS = new HashMap<>();
    private static final List<String> PUNCTUATORS_LONGEST_FIRST;

    static {
        PUNCTUATORS.put("{", OPEN_BRACE);
        PUNCTUATORS.put("}", CLOSE_BRACE);
        PUNCTUATORS.put("(", OPEN_PAREN);
        PUNCTUATORS.put(")", CLOSE_PAREN);
        PUNCTUATORS.put("[", OPEN_BRACKET);
        PUNCTUATORS.put("]", CLOSE_BRACKET);
        PUNCTUATORS.put(".", DOT);
        PUNCTUATORS.put("...", DOT_DOT_DOT);
        PUNCTUATORS.put("?.", QUESTION_DOT);
        PUNCTUATORS.put(";", SEMICOLON);
        PUNCTUATORS.put(",", COMMA);
        PUNCTUATORS.put(":", COLON);
        PUNCTUATORS.put("?", QUESTION);
        PUNCTUATORS.put("@", AT);
        PUNCTUATORS.put("=>", ARROW);
        PUNCTUATORS.put("<", LESS_THAN);
        PUNCTUATORS.put(">", GREATER_THAN);
        PUNCTUATORS.put("<=", LESS_EQUALS);
        PUNCTUATORS.put("==", EQUALS_EQUALS);
        PUNCTUATORS.put("!=", EXCLAMATION_EQUALS);
        PUNCTUATORS.put("===", EQUALS_EQUALS_EQUALS);
        PUNCTUATORS.put("!==", EXCLAMATION_EQUALS_EQUALS);
        PUNCTUATORS.put("+", PLUS);
        PUNCTUATORS.put("-", MINUS);
        PUNCTUATORS.put("*", ASTERISK);
        PUNCTUATORS.put("**", ASTERISK_ASTERISK);
        PUNCTUATORS.put("/", SLASH);
        PUNCTUATORS.put("%", PERCENT);
        PUNCTUATORS.put("++", PLUS_PLUS);
        PUNCTUATORS.put("--", MINUS_MINUS);
        PUNCTUATORS.put("<<", LESS_LESS);
        PUNCTUATORS.put("&", AMPERSAND);
        PUNCTUATORS.put("|", BAR);
        PUNCTUATORS.put("^", CARET);
        PUNCTUATORS.put("!", EXCLAMATION);
        PUNCTUATORS.put("~", TILDE);
        PUNCTUATORS.put("&&", AMPERSAND_AMPERSAND);
        PUNCTUATORS.put("||", BAR_BAR);
        PUNCTUATORS.put("??", QUESTION_QUESTION);
        PUNCTUATORS.put("=", EQUALS);
        PUNCTUATORS.put("+=", PLUS_EQUALS);
        PUNCTUATORS.put("-=", MINUS_EQUALS);
        PUNCTUATORS.put("*=", ASTERISK_EQUALS);
        PUNCTUATORS.put("**=", ASTERISK_ASTERISK_EQUALS);
        PUNCTUATORS.put("/=", SLASH_EQUALS);
        PUNCTUATORS.put("%=", PERCENT_EQUALS);
        PUNCTUATORS.put("<<=", LESS_LESS_EQUALS);
        PUNCTUATORS.put("&=", AMPERSAND_EQUALS);
        PUNCTUATORS.put("|=", BAR_EQUALS);
        PUNCTUATORS.put("^=", CARET_EQUALS);
        PUNCTUATORS.put("&&=", AMPERSAND_AMPERSAND_EQUALS);
        PUNCTUATORS.put("||=", BAR_BAR_EQUALS);
        PUNCTUATORS.put("??=", QUESTION_QUESTION_EQUALS);
        PUNCTUATORS_LONGEST_FIRST = PUNCTUATORS.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    private final String source;
    private final FileVariant variant;
    private final List<String> customSymbols;
    private final List<Token> tokens = new ArrayList<>();
    private final List<ScanError> errors = new ArrayList<>();
    private final Deque<Integer> templateBraceDepths = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int braceDepth = 0;
    private boolean scanned = false;

    /**
     * Creates a scanner over the given source.
     * @param source  The source text.
     * @param options The custom operators and file variant.
     */
    public Scanner(String source, ScannerOptions options) {
        this.source = source;
        this.variant = options.fileVariant();
        this.customSymbols = options.customOperators().stream()
                .map(CustomOperatorDef::symbol)
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    /**
     * Convenience entry point that scans the source and returns its tokens.
     * @param source  The source text.
     * @param options The scanner options.
     * @return The tokens, without an end-of-file marker.
     */
    public static List<Token> tokenize(String source, ScannerOptions options) {
        return new Scanner(source, options).scanTokens();
    }

    /**
     * Scans the whole source. Repeated calls return the same list.
     * @return The tokens in source order.
     */
    public List<Token> scanTokens() {
        if (scanned) {
            return tokens;
        }
        scanned = true;
        if (source.startsWith("#!")) {
            while (!isAtEnd() && peek() != '\n') {
                current++;
            }
        }
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    /**
     * Checks whether a symbol is an operator of the host grammar, including the forms the host scanner
     * composes from {@code >} when it re-scans.
     * @param symbol The operator symbol.
     * @return true if the host parser accepts the symbol.
     */
    public static boolean isNativePunctuator(String symbol) {
        return PUNCTUATORS.containsKey(symbol) || COMPOSED_GREATER_THAN.contains(symbol);
    }

    public List<ScanError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private void scanToken() {
        char c = peek();

        if (Character.isWhitespace(c)) {
            current++;
            return;
        }
        if (c == '/' && peekNext() == '/') {
            while (!isAtEnd() && peek() != '\n') {
                current++;
            }
            return;
        }
        if (c == '/' && peekNext() == '*') {
            blockComment();
            return;
        }
        if (c == '"' || c == '\'') {
            current++;
            string(c);
            return;
        }
        if (c == '`') {
            current++;
            template(true);
            return;
        }
        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
            number();
            return;
        }
        if (isIdentifierStart(c)) {
            identifier();
            return;
        }
        if (c == '#') {
            current++;
            if (!isAtEnd() && isIdentifierStart(peek())) {
                while (!isAtEnd() && isIdentifierPart(peek())) {
                    current++;
                }
                addToken(PRIVATE_NAME);
            } else {
                addToken(HASH);
            }
            return;
        }
        if (c == '}' && !templateBraceDepths.isEmpty() && templateBraceDepths.peek() == braceDepth) {
            templateBraceDepths.pop();
            current++;
            template(false);
            return;
        }
        punctuation();
    }

    private void punctuation() {
        String builtin = matchPunctuator();
        String custom = matchCustomOperator();
        int builtinLength = builtin == null ? 0 : builtin.length();

        if (custom != null && custom.length() >= builtinLength) {
            current += custom.length();
            tokens.add(new Token(CUSTOM_OPERATOR, custom, start, current, true));
            return;
        }
        if (variant == FileVariant.MARKUP && source.startsWith("</", current)) {
            current += 2;
            addToken(LESS_SLASH);
            return;
        }
        if (peek() == '/' && regexAllowed()) {
            current++;
            regex();
            return;
        }
        if (builtin == null) {
            current++;
            errors.add(new ScanError("Unexpected character: '" + source.charAt(start) + "'", start, current));
            addToken(UNKNOWN);
            return;
        }

        // '?.' followed by a digit is a conditional followed by a number
        if (builtin.equals("?.") && isDigit(charAt(current + 2))) {
            builtin = "?";
        }
        current += builtin.length();
        TokenKind kind = PUNCTUATORS.get(builtin);
        if (kind == OPEN_BRACE) {
            braceDepth++;
        } else if (kind == CLOSE_BRACE) {
            braceDepth--;
        }
        addToken(kind);
    }

    private String matchPunctuator() {
        for (String p : PUNCTUATORS_LONGEST_FIRST) {
            if (source.startsWith(p, current)) {
                return p;
            }
        }
        return null;
    }

    private String matchCustomOperator() {
        for (String symbol : customSymbols) {
            if (source.startsWith(symbol, current)) {
                return symbol;
            }
        }
        return null;
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token last = tokens.get(tokens.size() - 1);
        return switch (last.kind()) {
            case IDENTIFIER, NUMBER, STRING, REGEX, NO_SUBSTITUTION_TEMPLATE, TEMPLATE_TAIL, PRIVATE_NAME,
                 CLOSE_PAREN, CLOSE_BRACKET, CLOSE_BRACE, PLUS_PLUS, MINUS_MINUS -> false;
            case KEYWORD -> !VALUE_KEYWORDS.contains(last.text());
            default -> true;
        };
    }

    private void regex() {
        boolean inClass = false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                current += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                current++;
                while (!isAtEnd() && isIdentifierPart(peek())) {
                    current++;
                }
                addToken(REGEX);
                return;
            }
            current++;
        }
        current = Math.min(current, source.length());
        errors.add(new ScanError("Unterminated regular expression literal", start, current));
        addToken(REGEX);
    }

    private void string(char quote) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                break;
            }
            if (peek() == '\\') {
                current++;
            }
            current++;
        }
        if (isAtEnd() || peek() != quote) {
            current = Math.min(current, source.length());
            errors.add(new ScanError("Unterminated string literal", start, current));
            addToken(STRING);
            return;
        }
        current++;
        addToken(STRING);
    }

    /**
     * Scans template text up to the closing backtick or the next substitution.
     * @param head true if the scan started at an opening backtick, false if it resumed after a substitution.
     */
    private void template(boolean head) {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\') {
                current += 2;
                continue;
            }
            if (c == '`') {
                current++;
                addToken(head ? NO_SUBSTITUTION_TEMPLATE : TEMPLATE_TAIL);
                return;
            }
            if (c == '$' && peekNext() == '{') {
                current += 2;
                addToken(head ? TEMPLATE_HEAD : TEMPLATE_MIDDLE);
                templateBraceDepths.push(braceDepth);
                return;
            }
            current++;
        }
        current = Math.min(current, source.length());
        errors.add(new ScanError("Unterminated template literal", start, current));
        addToken(head ? NO_SUBSTITUTION_TEMPLATE : TEMPLATE_TAIL);
    }

    private void blockComment() {
        current += 2;
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                current += 2;
                return;
            }
            current++;
        }
        errors.add(new ScanError("Unterminated block comment", start, current));
    }

    private void number() {
        boolean hex = peek() == '0' && (peekNext() == 'x' || peekNext() == 'X');
        boolean seenDot = false;
        while (!isAtEnd()) {
            char c = peek();
            if (isIdentifierPart(c)) {
                current++;
            } else if (c == '.' && !seenDot && !hex && isDigit(peekNext())) {
                seenDot = true;
                current++;
            } else if (c == '.' && !seenDot && !hex && current > start && isDigit(source.charAt(current - 1))
                    && !isIdentifierStart(peekNext()) && peekNext() != '.') {
                seenDot = true;
                current++;
            } else if ((c == '+' || c == '-') && !hex && current > start
                    && (source.charAt(current - 1) == 'e' || source.charAt(current - 1) == 'E')) {
                current++;
            } else {
                break;
            }
        }
        addToken(NUMBER);
    }

    private void identifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            current++;
        }
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, IDENTIFIER));
    }

    private void addToken(TokenKind kind) {
        tokens.add(new Token(kind, source.substring(start, current), start, current, false));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return charAt(current);
    }

    private char peekNext() {
        return charAt(current + 1);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '$' || c == '_' || Character.isLetterOrDigit(c);
    }
}
