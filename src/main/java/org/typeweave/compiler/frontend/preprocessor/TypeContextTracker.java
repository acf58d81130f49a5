package org.typeweave.compiler.frontend.preprocessor;

import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies every token of a file as being inside or outside a type context, in a single forward scan.
 * <p>
 * The scan is an explicit state machine over {@link ContextState} plus a generic angle-bracket depth:
 * <ul>
 *   <li>{@code type X = ...} aliases stay in {@link ContextState#TYPE_ALIAS} until the terminating
 *       {@code ;}, an unmatched closing bracket, or the next declaration at the alias' own level.</li>
 *   <li>{@code interface X ... { }} stays in {@link ContextState#INTERFACE_BODY} up to the matching
 *       closing brace.</li>
 *   <li>A {@code :} enters {@link ContextState#TYPE_ANNOTATION}; {@code =}, {@code ,}, {@code ;},
 *       {@code {}, an arrow that is not part of a function type, or the closing bracket of the enclosing
 *       parameter list leave it. Colons of conditional expressions, {@code case}/{@code default} labels
 *       and object literal properties do not enter it. A {@code {} directly inside an annotation opens
 *       an object type literal, which stays in type context up to its closing brace.</li>
 *   <li>A {@code <} counts as a generic opener only after an identifier, {@code type}, {@code interface},
 *       {@code class} or {@code function}, and only if a matching {@code >} follows before a statement
 *       end, a logical operator or an unmatched closing bracket.</li>
 * </ul>
 */
public class TypeContextTracker {

    /**
     * The lexical context a token is found in.
     */
    public enum ContextState {
        VALUE,
        TYPE_ANNOTATION,
        TYPE_ALIAS,
        INTERFACE_BODY
    }

    /**
     * The classification of one token.
     *
     * @param state        The context state.
     * @param genericDepth The number of open generic argument lists.
     */
    public record Context(ContextState state, int genericDepth) {
        public boolean isTypeContext() {
            return state != ContextState.VALUE || genericDepth > 0;
        }
    }

    private enum FrameKind { ROOT, PAREN, BRACKET, BLOCK, OBJECT, TYPE_LITERAL }

    private static final class Frame {
        final FrameKind kind;
        final int annotationBase;
        final boolean openedInAnnotation;
        int pendingTernaries;
        int pendingCaseLabels;

        Frame(FrameKind kind, int annotationBase, boolean openedInAnnotation) {
            this.kind = kind;
            this.annotationBase = annotationBase;
            this.openedInAnnotation = openedInAnnotation;
        }
    }

    private static final Set<TokenKind> GENERIC_OPENERS = EnumSet.of(
            TokenKind.IDENTIFIER, TokenKind.TYPE, TokenKind.INTERFACE, TokenKind.CLASS, TokenKind.FUNCTION);

    private static final Set<TokenKind> GENERIC_STOPPERS = EnumSet.of(
            TokenKind.SEMICOLON, TokenKind.AMPERSAND_AMPERSAND, TokenKind.BAR_BAR, TokenKind.QUESTION_QUESTION,
            TokenKind.EQUALS_EQUALS, TokenKind.EQUALS_EQUALS_EQUALS, TokenKind.EXCLAMATION_EQUALS,
            TokenKind.EXCLAMATION_EQUALS_EQUALS, TokenKind.LESS_EQUALS, TokenKind.LESS_LESS);

    private static final Set<TokenKind> TYPE_LITERAL_OPENERS = EnumSet.of(
            TokenKind.COLON, TokenKind.BAR, TokenKind.AMPERSAND, TokenKind.LESS_THAN, TokenKind.COMMA,
            TokenKind.OPEN_PAREN, TokenKind.OPEN_BRACKET);

    private static final Set<TokenKind> EXPRESSION_PREFIXES = EnumSet.of(
            TokenKind.EQUALS, TokenKind.OPEN_PAREN, TokenKind.OPEN_BRACKET, TokenKind.COMMA, TokenKind.COLON,
            TokenKind.QUESTION, TokenKind.RETURN, TokenKind.YIELD, TokenKind.THROW, TokenKind.AMPERSAND_AMPERSAND,
            TokenKind.BAR_BAR, TokenKind.QUESTION_QUESTION, TokenKind.DOT_DOT_DOT, TokenKind.CUSTOM_OPERATOR,
            TokenKind.TEMPLATE_HEAD, TokenKind.TEMPLATE_MIDDLE, TokenKind.EXCLAMATION, TokenKind.PLUS_EQUALS,
            TokenKind.QUESTION_QUESTION_EQUALS, TokenKind.BAR_BAR_EQUALS, TokenKind.AMPERSAND_AMPERSAND_EQUALS);

    private static final Set<TokenKind> DECLARATION_STARTS = EnumSet.of(
            TokenKind.CONST, TokenKind.LET, TokenKind.VAR, TokenKind.FUNCTION, TokenKind.CLASS,
            TokenKind.INTERFACE, TokenKind.ENUM, TokenKind.EXPORT, TokenKind.IMPORT, TokenKind.DECLARE,
            TokenKind.RETURN, TokenKind.NAMESPACE);

    private final Deque<Frame> frames = new ArrayDeque<>();
    private int annotationDepth;
    private int typeLiteralDepth;
    private int genericDepth;
    private boolean aliasActive;
    private boolean aliasSeenEquals;
    private int aliasNesting;
    private boolean interfaceActive;
    private int interfaceBraceDepth;
    private int lastTypeParenClose;

    /**
     * Classifies all tokens of a file.
     * @param tokens The tokens in source order.
     * @return One context per token, in the same order.
     */
    public List<Context> classify(List<Token> tokens) {
        reset();
        List<Context> contexts = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            step(tokens, i);
            contexts.add(current());
        }
        return contexts;
    }

    private void reset() {
        frames.clear();
        frames.push(new Frame(FrameKind.ROOT, 0, false));
        annotationDepth = 0;
        typeLiteralDepth = 0;
        genericDepth = 0;
        aliasActive = false;
        aliasSeenEquals = false;
        aliasNesting = 0;
        interfaceActive = false;
        interfaceBraceDepth = 0;
        lastTypeParenClose = -1;
    }

    private Context current() {
        ContextState state;
        if (interfaceActive) {
            state = ContextState.INTERFACE_BODY;
        } else if (aliasActive) {
            state = ContextState.TYPE_ALIAS;
        } else if (annotationDepth > 0 || typeLiteralDepth > 0) {
            state = ContextState.TYPE_ANNOTATION;
        } else {
            state = ContextState.VALUE;
        }
        return new Context(state, genericDepth);
    }

    private boolean inTypeContext() {
        return interfaceActive || aliasActive || annotationDepth > 0 || typeLiteralDepth > 0 || genericDepth > 0;
    }

    private void step(List<Token> tokens, int i) {
        Token t = tokens.get(i);
        if (t.isCustomOperator()) {
            return;
        }
        Token prev = i > 0 ? tokens.get(i - 1) : null;
        Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

        if (aliasActive && aliasSeenEquals && aliasNesting == 0 && startsDeclaration(t, next)) {
            aliasActive = false;
        }

        switch (t.kind()) {
            case TYPE -> {
                if (!aliasActive && !interfaceActive && isIdentifier(next) && !isMemberAccess(prev)) {
                    aliasActive = true;
                    aliasSeenEquals = false;
                    aliasNesting = 0;
                }
            }
            case INTERFACE -> {
                if (!aliasActive && !interfaceActive && isIdentifier(next)) {
                    interfaceActive = true;
                    interfaceBraceDepth = 0;
                }
            }
            case LESS_THAN -> {
                if (prev != null && GENERIC_OPENERS.contains(prev.kind()) && looksLikeGeneric(tokens, i)) {
                    genericDepth++;
                }
            }
            case GREATER_THAN -> {
                if (genericDepth > 0) {
                    genericDepth--;
                }
            }
            case EQUALS -> {
                // '>=' is split by the scanner and is not an assignment
                boolean comparison = prev != null && prev.kind() == TokenKind.GREATER_THAN
                        && prev.end() == t.start() && genericDepth == 0;
                if (aliasActive && aliasNesting == 0) {
                    aliasSeenEquals = true;
                } else if (!aliasActive && !comparison && genericDepth == 0) {
                    exitAnnotations();
                }
            }
            case SEMICOLON -> {
                if (aliasActive && aliasNesting <= 0) {
                    aliasActive = false;
                }
                exitAnnotations();
                frames.peek().pendingTernaries = 0;
                frames.peek().pendingCaseLabels = 0;
            }
            case COMMA -> {
                if (!aliasActive && genericDepth == 0) {
                    exitAnnotations();
                }
            }
            case ARROW -> {
                if (!aliasActive && annotationDepth > frames.peek().annotationBase && lastTypeParenClose != i - 1) {
                    exitAnnotations();
                }
            }
            case QUESTION -> {
                if (!inTypeContext() && isTernary(next)) {
                    frames.peek().pendingTernaries++;
                }
            }
            case CASE -> {
                if (!inTypeContext()) {
                    frames.peek().pendingCaseLabels++;
                }
            }
            case COLON -> colon(prev);
            case OPEN_PAREN -> openFrame(FrameKind.PAREN);
            case OPEN_BRACKET -> openFrame(FrameKind.BRACKET);
            case OPEN_BRACE -> openBrace(prev);
            case CLOSE_PAREN, CLOSE_BRACKET, CLOSE_BRACE -> close(t, i);
            default -> {
            }
        }
    }

    private void colon(Token prev) {
        if (aliasActive || interfaceActive) {
            return;
        }
        Frame top = frames.peek();
        if (top.pendingTernaries > 0 && !inTypeContext()) {
            top.pendingTernaries--;
            return;
        }
        if (top.kind == FrameKind.OBJECT && annotationDepth == top.annotationBase) {
            return;
        }
        if (prev != null && prev.kind() == TokenKind.DEFAULT) {
            return;
        }
        if (top.pendingCaseLabels > 0 && annotationDepth == top.annotationBase) {
            top.pendingCaseLabels--;
            return;
        }
        annotationDepth++;
    }

    private void openFrame(FrameKind kind) {
        frames.push(new Frame(kind, annotationDepth, annotationDepth > 0));
        if (aliasActive) {
            aliasNesting++;
        }
    }

    private void openBrace(Token prev) {
        if (interfaceActive) {
            interfaceBraceDepth++;
            frames.push(new Frame(FrameKind.BLOCK, annotationDepth, false));
            return;
        }
        if (aliasActive) {
            aliasNesting++;
            frames.push(new Frame(FrameKind.BLOCK, annotationDepth, false));
            return;
        }
        if (annotationDepth > frames.peek().annotationBase) {
            if (prev != null && TYPE_LITERAL_OPENERS.contains(prev.kind())) {
                typeLiteralDepth++;
                frames.push(new Frame(FrameKind.TYPE_LITERAL, annotationDepth, true));
                return;
            }
            exitAnnotations();
        }
        boolean object = prev != null && (EXPRESSION_PREFIXES.contains(prev.kind()) || prev.isCustomOperator());
        frames.push(new Frame(object ? FrameKind.OBJECT : FrameKind.BLOCK, annotationDepth, false));
    }

    private void close(Token t, int index) {
        if (frames.size() > 1) {
            Frame frame = frames.pop();
            if (frame.kind == FrameKind.TYPE_LITERAL) {
                typeLiteralDepth--;
            }
            annotationDepth = frame.annotationBase;
            if (t.kind() == TokenKind.CLOSE_PAREN && frame.openedInAnnotation) {
                lastTypeParenClose = index;
            }
        }
        if (aliasActive) {
            aliasNesting--;
            if (aliasNesting < 0) {
                aliasActive = false;
            }
        }
        if (interfaceActive && t.kind() == TokenKind.CLOSE_BRACE) {
            interfaceBraceDepth--;
            if (interfaceBraceDepth <= 0) {
                interfaceActive = false;
            }
        }
    }

    private void exitAnnotations() {
        annotationDepth = Math.min(annotationDepth, frames.peek().annotationBase);
    }

    private static boolean startsDeclaration(Token t, Token next) {
        if (DECLARATION_STARTS.contains(t.kind())) {
            return true;
        }
        return t.kind() == TokenKind.TYPE && isIdentifier(next);
    }

    private static boolean isIdentifier(Token t) {
        return t != null && t.kind() == TokenKind.IDENTIFIER;
    }

    private static boolean isMemberAccess(Token prev) {
        return prev != null && (prev.kind() == TokenKind.DOT || prev.kind() == TokenKind.QUESTION_DOT);
    }

    private static boolean isTernary(Token next) {
        if (next == null) {
            return false;
        }
        return switch (next.kind()) {
            case COLON, CLOSE_PAREN, COMMA, EQUALS -> false;
            default -> true;
        };
    }

    /**
     * Looks ahead from a {@code <} for the {@code >} that would close it as a generic argument list.
     */
    static boolean looksLikeGeneric(List<Token> tokens, int lessThanIndex) {
        int angle = 1;
        int nested = 0;
        for (int j = lessThanIndex + 1; j < tokens.size(); j++) {
            Token t = tokens.get(j);
            if (t.isCustomOperator()) {
                if (nested == 0) {
                    return false;
                }
                continue;
            }
            switch (t.kind()) {
                case LESS_THAN -> angle++;
                case GREATER_THAN -> {
                    angle--;
                    if (angle == 0) {
                        return true;
                    }
                }
                case OPEN_PAREN, OPEN_BRACE, OPEN_BRACKET -> nested++;
                case CLOSE_PAREN, CLOSE_BRACE, CLOSE_BRACKET -> {
                    nested--;
                    if (nested < 0) {
                        return false;
                    }
                }
                default -> {
                    if (nested == 0 && GENERIC_STOPPERS.contains(t.kind())) {
                        return false;
                    }
                }
            }
        }
        return false;
    }
}
