package org.typeweave.compiler.macro;

import org.typeweave.compiler.check.ITypeChecker;
import org.typeweave.compiler.check.PropertyInfo;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.diagnostics.DiagnosticsEngine;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.host.SourceFile;
import org.typeweave.compiler.host.SyntaxValidator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * The macro context over one source file, backed by a type checker and the syntax validator.
 * Diagnostics are positioned in the text of {@link #sourceFile()}.
 */
public class DefaultMacroContext implements MacroContext {

    public static final String PHASE = "macro";

    private final SourceFile sourceFile;
    private final ITypeChecker typeChecker;
    private final SyntaxValidator validator;
    private final DiagnosticsEngine diagnostics;
    private final NodeFactory nodeFactory = new NodeFactory();
    private final Set<String> issuedNames = new HashSet<>();
    private IntUnaryOperator positionMapper = IntUnaryOperator.identity();
    private String currentText;

    public DefaultMacroContext(SourceFile sourceFile, ITypeChecker typeChecker, SyntaxValidator validator,
                               DiagnosticsEngine diagnostics) {
        this.sourceFile = sourceFile;
        this.typeChecker = typeChecker;
        this.validator = validator;
        this.diagnostics = diagnostics;
        this.currentText = sourceFile.text();
    }

    /**
     * Sets the text node offsets refer to and how those offsets map back to the source file text.
     * The expander calls this before every pass.
     */
    void updateText(String text, IntUnaryOperator mapper) {
        this.currentText = text;
        this.positionMapper = mapper;
    }

    @Override
    public NodeFactory nodeFactory() {
        return nodeFactory;
    }

    @Override
    public String typeOf(SyntaxNode node) {
        return typeChecker.typeOfExpression(sourceFile.fileName(), node.text());
    }

    @Override
    public List<PropertyInfo> propertiesOf(String typeName) {
        return typeChecker.getPropertiesOfType(typeName);
    }

    @Override
    public String uniqueName(String base) {
        String stem = base == null || base.isBlank() ? "tmp" : base.replaceAll("[^A-Za-z0-9_$]", "_");
        int counter = 0;
        String candidate;
        do {
            candidate = "__" + stem + "_" + counter++;
        } while (issuedNames.contains(candidate) || currentText.contains(candidate)
                || sourceFile.text().contains(candidate));
        issuedNames.add(candidate);
        return candidate;
    }

    @Override
    public SyntaxNode parseExpression(String code) {
        List<Diagnostic> problems = validator.validateExpression(code);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid expression '" + code + "': " + problems.get(0).message());
        }
        String text = code.strip();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).strip();
        }
        return SyntaxNode.synthetic(classify(text), text);
    }

    @Override
    public List<SyntaxNode> parseStatements(String code) {
        List<Diagnostic> problems = validator.validateStatements(code);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid statements: " + problems.get(0).message());
        }
        TokenStream stream = TokenStream.of(code, ScannerOptions.forFile(List.of(), sourceFile.fileName()));
        List<SyntaxNode> statements = new ArrayList<>();
        int depth = 0;
        int first = 0;
        for (int i = 0; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t)) {
                depth--;
            }
            boolean terminated = depth == 0 && (t.is(TokenKind.SEMICOLON) || (t.is(TokenKind.CLOSE_BRACE)
                    && (i + 1 == stream.size() || code.substring(t.end(), stream.get(i + 1).start()).contains("\n"))));
            if (terminated || i == stream.size() - 1) {
                statements.add(SyntaxNode.synthetic(NodeKind.STATEMENT, stream.textBetween(first, i).strip()));
                first = i + 1;
            }
        }
        return statements;
    }

    @Override
    public void reportError(SyntaxNode node, String message) {
        diagnostics.reportError(message, sourceFile.fileName(), position(node), node == null ? 0 : node.length(), PHASE);
    }

    @Override
    public void reportWarning(SyntaxNode node, String message) {
        diagnostics.reportWarning(message, sourceFile.fileName(), position(node), node == null ? 0 : node.length(), PHASE);
    }

    @Override
    public SourceFile sourceFile() {
        return sourceFile;
    }

    int position(SyntaxNode node) {
        if (node == null || node.isSynthetic()) {
            return -1;
        }
        return positionMapper.applyAsInt(node.start());
    }

    /**
     * Derives the node kind of an expression from its text.
     */
    static NodeKind classify(String text) {
        TokenStream stream = TokenStream.of(text, ScannerOptions.forFile(List.of(), null));
        int size = stream.size();
        if (size == 0) {
            return NodeKind.EXPRESSION;
        }
        Token first = stream.get(0);
        if (size == 1) {
            return switch (first.kind()) {
                case IDENTIFIER -> NodeKind.IDENTIFIER;
                case STRING, NO_SUBSTITUTION_TEMPLATE -> NodeKind.STRING_LITERAL;
                case NUMBER -> NodeKind.NUMERIC_LITERAL;
                case KEYWORD -> first.text().equals("true") || first.text().equals("false")
                        ? NodeKind.BOOLEAN_LITERAL : NodeKind.EXPRESSION;
                default -> NodeKind.EXPRESSION;
            };
        }
        if (first.is(TokenKind.OPEN_BRACKET) && stream.findMatchingClose(0) == size - 1) {
            return NodeKind.ARRAY_LITERAL;
        }
        if (first.is(TokenKind.OPEN_BRACE) && stream.findMatchingClose(0) == size - 1) {
            return NodeKind.OBJECT_LITERAL;
        }
        if (stream.get(size - 1).is(TokenKind.CLOSE_PAREN)) {
            int open = stream.findMatchingOpen(size - 1);
            if (open > 0 && stream.get(open - 1).is(TokenKind.IDENTIFIER)) {
                return NodeKind.CALL;
            }
        }
        return NodeKind.EXPRESSION;
    }
}
