package org.typeweave.compiler.frontend.preprocessor.features.decorator;

import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.frontend.preprocessor.IStructuralExtension;
import org.typeweave.compiler.frontend.preprocessor.Replacement;
import org.typeweave.compiler.frontend.preprocessor.RewriteOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites decorators in positions the host grammar does not accept.
 * <p>
 * {@code @instance(arg)} on a variable declaration wraps the initializer:
 * <pre>
 * &#64;instance("Eq&lt;Point&gt;")
 * export const pointEq = { ... };
 * </pre>
 * becomes {@code export const pointEq = instance("Eq<Point>", { ... });}. Stacked decorators apply
 * bottom-up, so the decorator closest to the declaration becomes the innermost call.
 * <p>
 * {@code @typeclass} or {@code @typeclass(options)} on an interface is removed and a registration call
 * {@code typeclass("Name"[, options]);} is appended after the interface body.
 */
public class DecoratorRewriteExtension implements IStructuralExtension {

    public static final String NAME = "decorator-rewrite";

    private record Decorator(int start, int end, String argument) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Replacement> rewrite(TokenStream stream, String source, RewriteOptions options) {
        List<Replacement> replacements = new ArrayList<>();
        rewriteInstances(stream, source, replacements);
        rewriteTypeclasses(stream, source, replacements);
        replacements.sort(Comparator.comparingInt(Replacement::start));
        return replacements;
    }

    private void rewriteInstances(TokenStream stream, String source, List<Replacement> out) {
        int i = 0;
        while (i < stream.size()) {
            List<Decorator> decorators = new ArrayList<>();
            int next = i;
            Decorator decorator;
            while ((decorator = parseDecorator(stream, source, next, "instance", true)) != null) {
                decorators.add(decorator);
                next = stream.indexAtOrAfter(decorator.end());
            }
            if (decorators.isEmpty()) {
                i++;
                continue;
            }

            int j = skipExports(stream, next);
            Token keyword = stream.get(j);
            if (keyword == null || !(keyword.is(TokenKind.CONST) || keyword.is(TokenKind.LET) || keyword.is(TokenKind.VAR))
                    || stream.get(j + 1) == null || !stream.get(j + 1).is(TokenKind.IDENTIFIER)) {
                i = next;
                continue;
            }
            j += 2;
            if (stream.get(j) != null && stream.get(j).is(TokenKind.COLON)) {
                j = skipTypeAnnotation(stream, j + 1);
            }
            if (j < 0 || stream.get(j) == null || !stream.get(j).is(TokenKind.EQUALS) || stream.get(j + 1) == null) {
                i = next;
                continue;
            }
            int initializerStart = stream.get(j + 1).start();
            int endIndex = findInitializerEnd(stream, j + 1);
            if (endIndex < j + 1) {
                i = next;
                continue;
            }
            int initializerEnd = stream.get(endIndex).end();

            String wrapped = source.substring(initializerStart, initializerEnd);
            for (int d = decorators.size() - 1; d >= 0; d--) {
                wrapped = "instance(" + decorators.get(d).argument() + ", " + wrapped + ")";
            }
            for (Decorator d : decorators) {
                out.add(new Replacement(d.start(), d.end(), ""));
            }
            out.add(new Replacement(initializerStart, initializerEnd, wrapped));
            i = endIndex + 1;
        }
    }

    private void rewriteTypeclasses(TokenStream stream, String source, List<Replacement> out) {
        for (int i = 0; i < stream.size(); i++) {
            Decorator decorator = parseDecorator(stream, source, i, "typeclass", false);
            if (decorator == null) {
                continue;
            }
            int j = skipExports(stream, stream.indexAtOrAfter(decorator.end()));
            Token keyword = stream.get(j);
            Token name = stream.get(j + 1);
            if (keyword == null || !keyword.is(TokenKind.INTERFACE) || name == null || !name.is(TokenKind.IDENTIFIER)) {
                continue;
            }
            j += 2;
            if (stream.get(j) != null && stream.get(j).is(TokenKind.LESS_THAN)) {
                int close = stream.findMatchingAngle(j);
                if (close < 0) {
                    continue;
                }
                j = close + 1;
            }
            if (stream.get(j) != null && stream.get(j).is(TokenKind.EXTENDS)) {
                while (stream.get(j) != null && !stream.get(j).is(TokenKind.OPEN_BRACE)) {
                    j++;
                }
            }
            if (stream.get(j) == null || !stream.get(j).is(TokenKind.OPEN_BRACE)) {
                continue;
            }
            int closeBrace = stream.findMatchingClose(j);
            if (closeBrace < 0) {
                continue;
            }
            String call = decorator.argument() == null
                    ? "\ntypeclass(\"" + name.text() + "\");"
                    : "\ntypeclass(\"" + name.text() + "\", " + decorator.argument() + ");";
            out.add(new Replacement(decorator.start(), decorator.end(), ""));
            int insertAt = stream.get(closeBrace).end();
            out.add(new Replacement(insertAt, insertAt, call));
            i = closeBrace;
        }
    }

    /**
     * Parses {@code @name} or {@code @name(args)} at a token index.
     * @param requireArguments true if the parenthesized argument list is mandatory.
     * @return The decorator, with a null argument when there is none, or null if no decorator starts here.
     */
    private static Decorator parseDecorator(TokenStream stream, String source, int index, String name,
                                            boolean requireArguments) {
        Token at = stream.get(index);
        Token ident = stream.get(index + 1);
        if (at == null || !at.is(TokenKind.AT) || ident == null || !ident.is(TokenKind.IDENTIFIER)
                || !ident.text().equals(name)) {
            return null;
        }
        Token paren = stream.get(index + 2);
        if (paren == null || !paren.is(TokenKind.OPEN_PAREN)) {
            return requireArguments ? null : new Decorator(at.start(), ident.end(), null);
        }
        int close = stream.findMatchingClose(index + 2);
        if (close < 0) {
            return null;
        }
        String argument = source.substring(paren.end(), stream.get(close).start()).strip();
        return new Decorator(at.start(), stream.get(close).end(), argument.isEmpty() ? null : argument);
    }

    private static int skipExports(TokenStream stream, int index) {
        int j = index;
        while (stream.get(j) != null && stream.get(j).is(TokenKind.EXPORT)) {
            j++;
        }
        return j;
    }

    /**
     * @return The index of the token ending the annotation ({@code =}, {@code ;} or {@code ,} at depth 0), or -1.
     */
    private static int skipTypeAnnotation(TokenStream stream, int from) {
        int depth = 0;
        for (int i = from; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t) || t.is(TokenKind.LESS_THAN)) {
                depth++;
            } else if ((TokenStream.isCloseBracket(t) || t.is(TokenKind.GREATER_THAN)) && depth > 0) {
                depth--;
            } else if (depth == 0 && (t.is(TokenKind.EQUALS) || t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return The index of the last token of the initializer expression starting at {@code from}.
     */
    private static int findInitializerEnd(TokenStream stream, int from) {
        int depth = 0;
        int last = from - 1;
        for (int i = from; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t)) {
                depth++;
            } else if (TokenStream.isCloseBracket(t)) {
                if (depth == 0) {
                    return last;
                }
                depth--;
            } else if (depth == 0 && (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA))) {
                return last;
            }
            last = i;
        }
        return last;
    }
}
