package org.typeweave.compiler.macro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.check.ITypeChecker;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.diagnostics.DiagnosticsEngine;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.host.SourceFile;
import org.typeweave.compiler.host.SyntaxValidator;
import org.typeweave.compiler.sourcemap.EditableSource;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Expands calls of registered macros in preprocessed text.
 * <p>
 * Each pass finds the outermost macro calls, expands them and splices the results. Calls nested in an
 * argument are reached in a later pass if the expansion keeps them. Passes repeat until nothing changes or
 * the pass limit is hit. A macro that throws, or that returns text which is not a well-formed expression,
 * is reported as an error and its call is left untouched; expansion of the other calls continues.
 */
public class MacroExpander {

    private static final Logger log = LoggerFactory.getLogger(MacroExpander.class);

    public static final int DEFAULT_MAX_PASSES = 8;

    /** Tokens after which a name followed by a parenthesis is not a call. */
    private static final Set<TokenKind> NON_CALL_PREFIXES = EnumSet.of(
            TokenKind.DOT, TokenKind.QUESTION_DOT, TokenKind.FUNCTION, TokenKind.CONST, TokenKind.LET,
            TokenKind.VAR, TokenKind.CLASS, TokenKind.INTERFACE, TokenKind.TYPE, TokenKind.NEW);

    private record Site(IExpressionMacro macro, int nameIndex, int openIndex, int closeIndex) {
    }

    private final MacroRegistry registry;
    private final SyntaxValidator validator;
    private final int maxPasses;

    /**
     * @param registry  The macros to expand.
     * @param validator The validator for macro output.
     * @param maxPasses The maximum number of passes, at least 1.
     */
    public MacroExpander(MacroRegistry registry, SyntaxValidator validator, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        this.registry = registry;
        this.validator = validator;
        this.maxPasses = maxPasses;
    }

    /**
     * Expands the macros of one file.
     * @param file        The file; its text is the input.
     * @param typeChecker The type checker answering the context's type queries.
     * @return The expansion result; diagnostics are positioned in the file text.
     */
    public ExpansionResult expand(SourceFile file, ITypeChecker typeChecker) {
        String input = file.text();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        if (registry.isEmpty()) {
            return new ExpansionResult(input, false, null, List.of(), 0);
        }
        DefaultMacroContext context = new DefaultMacroContext(file, typeChecker, validator, diagnostics);

        String text = input;
        SourceMap map = null;
        int expansions = 0;
        int pass = 0;
        while (pass < maxPasses) {
            TokenStream stream = TokenStream.of(text, ScannerOptions.forFile(List.of(), file.fileName()));
            List<Site> sites = findOutermostSites(stream);
            if (sites.isEmpty()) {
                break;
            }
            pass++;
            SourceMap current = map;
            context.updateText(text, offset -> current == null ? offset : current.originalOffsetFor(offset));

            EditableSource edits = new EditableSource(text);
            for (Site site : sites) {
                CallSite call = toCallSite(stream, site);
                String replacement = expandOne(site.macro(), call, context);
                if (replacement != null) {
                    edits.overwrite(call.node().start(), call.node().end(), replacement);
                    expansions++;
                }
            }
            if (!edits.hasChanged()) {
                break;
            }
            map = SourceMap.compose(map, edits.generateMap(file.fileName(), file.fileName()));
            text = edits.toString();
        }

        if (pass == maxPasses) {
            List<Site> remaining = findOutermostSites(TokenStream.of(text, ScannerOptions.forFile(List.of(), file.fileName())));
            if (!remaining.isEmpty()) {
                log.warn("Macro expansion of {} stopped after {} passes with {} call(s) left",
                        file.fileName(), maxPasses, remaining.size());
                diagnostics.reportWarning("Macro expansion stopped after " + maxPasses + " passes; "
                        + remaining.size() + " call(s) left unexpanded", file.fileName(), -1, 0, DefaultMacroContext.PHASE);
            }
        }

        boolean changed = !text.equals(input);
        log.debug("Expanded {} macro call(s) in {} over {} pass(es)", expansions, file.fileName(), pass);
        return new ExpansionResult(text, changed, changed ? map : null, diagnostics.getDiagnostics(), expansions);
    }

    /**
     * Runs one macro, turning failures into diagnostics.
     * @return The replacement text, or null to keep the call.
     */
    private String expandOne(IExpressionMacro macro, CallSite call, DefaultMacroContext context) {
        SyntaxNode result;
        try {
            result = macro.expand(call, context);
        } catch (RuntimeException e) {
            log.warn("Macro '{}' failed in {}: {}", macro.name(), context.sourceFile().fileName(), e.getMessage());
            context.reportError(call.node(), "Macro '" + macro.name() + "' failed: " + e.getMessage());
            return null;
        }
        if (result == null) {
            return null;
        }
        List<Diagnostic> problems = validator.validateExpression(result.text());
        if (!problems.isEmpty()) {
            context.reportError(call.node(), "Macro '" + macro.name() + "' produced an invalid expression: "
                    + problems.get(0).message());
            return null;
        }
        return result.text();
    }

    private List<Site> findOutermostSites(TokenStream stream) {
        List<Site> sites = new ArrayList<>();
        for (int i = 0; i + 1 < stream.size(); i++) {
            Token name = stream.get(i);
            if (!name.is(TokenKind.IDENTIFIER) || !registry.contains(name.text())
                    || !stream.get(i + 1).is(TokenKind.OPEN_PAREN)) {
                continue;
            }
            Token previous = stream.get(i - 1);
            if (previous != null && NON_CALL_PREFIXES.contains(previous.kind())) {
                continue;
            }
            int close = stream.findMatchingClose(i + 1);
            if (close < 0) {
                continue;
            }
            Token after = stream.get(close + 1);
            if (after != null && (after.is(TokenKind.OPEN_BRACE) || after.is(TokenKind.COLON))) {
                // method or function signature, not a call
                continue;
            }
            sites.add(new Site(registry.get(name.text()).orElseThrow(), i, i + 1, close));
            i = close;
        }
        return sites;
    }

    private static CallSite toCallSite(TokenStream stream, Site site) {
        List<SyntaxNode> arguments = new ArrayList<>();
        int depth = 0;
        int first = site.openIndex() + 1;
        for (int i = first; i < site.closeIndex(); i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t)) {
                depth--;
            } else if (depth == 0 && t.is(TokenKind.COMMA)) {
                addArgument(stream, first, i - 1, arguments);
                first = i + 1;
            }
        }
        addArgument(stream, first, site.closeIndex() - 1, arguments);

        int start = stream.get(site.nameIndex()).start();
        int end = stream.get(site.closeIndex()).end();
        String text = stream.source().substring(start, end);
        return new CallSite(stream.get(site.nameIndex()).text(), arguments, new SyntaxNode(NodeKind.CALL, text, start, end));
    }

    private static void addArgument(TokenStream stream, int from, int to, List<SyntaxNode> out) {
        if (to < from) {
            return;
        }
        int start = stream.get(from).start();
        int end = stream.get(to).end();
        String text = stream.source().substring(start, end);
        out.add(new SyntaxNode(DefaultMacroContext.classify(text), text, start, end));
    }
}
