package org.typeweave.compiler.host;

import org.typeweave.compiler.frontend.io.SourceLoader;
import org.typeweave.compiler.frontend.lexer.Scanner;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the module specifiers a file imports and resolves the relative ones to file names through a host.
 * <p>
 * Recognized forms are static {@code import ... from "x"}, side-effect {@code import "x"},
 * re-exports {@code export ... from "x"} and dynamic {@code import("x")}. Only relative specifiers
 * ({@code ./} and {@code ../}) are resolved; package imports are not file dependencies.
 */
public final class DependencyExtractor {

    private static final List<String> RESOLVE_SUFFIXES = List.of(".ts", ".tsx", ".js", ".jsx");

    private DependencyExtractor() {}

    /**
     * Extracts the raw module specifiers in source order, without duplicates.
     * @param text     The file text.
     * @param fileName The file name, used for the grammar variant.
     * @return The specifiers.
     */
    public static List<String> extractSpecifiers(String text, String fileName) {
        List<Token> tokens = Scanner.tokenize(text, ScannerOptions.forFile(null, fileName));
        Set<String> specifiers = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean member = i > 0 && (tokens.get(i - 1).is(TokenKind.DOT) || tokens.get(i - 1).is(TokenKind.QUESTION_DOT));
            if (member) {
                continue;
            }
            if (token.is(TokenKind.IMPORT)) {
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                if (next != null && next.is(TokenKind.STRING)) {
                    specifiers.add(unquote(next.text()));
                } else if (next != null && next.is(TokenKind.OPEN_PAREN) && i + 2 < tokens.size()
                        && tokens.get(i + 2).is(TokenKind.STRING)) {
                    specifiers.add(unquote(tokens.get(i + 2).text()));
                } else {
                    fromClause(tokens, i + 1).ifPresent(specifiers::add);
                }
            } else if (token.is(TokenKind.EXPORT)) {
                fromClause(tokens, i + 1).ifPresent(specifiers::add);
            }
        }
        return new ArrayList<>(specifiers);
    }

    /**
     * Extracts and resolves the relative imports of a file.
     * @param text     The file text.
     * @param fileName The canonical name of the file.
     * @param host     The host used for existence checks and canonical names.
     * @return The canonical names of the resolved dependencies, in source order.
     */
    public static Set<String> resolveDependencies(String text, String fileName, ICompilerHost host) {
        Set<String> resolved = new LinkedHashSet<>();
        for (String specifier : extractSpecifiers(text, fileName)) {
            String target = resolve(specifier, fileName, host);
            if (target != null && !target.equals(fileName)) {
                resolved.add(target);
            }
        }
        return resolved;
    }

    /**
     * Resolves one specifier against the containing file: the exact name, the name with each known suffix,
     * then {@code index} files inside a directory of that name.
     * @return The canonical file name, or null if the specifier is not relative or nothing exists.
     */
    public static String resolve(String specifier, String containingFile, ICompilerHost host) {
        if (!specifier.startsWith("./") && !specifier.startsWith("../")) {
            return null;
        }
        String base = join(containingFile, specifier);
        List<String> candidates = new ArrayList<>();
        if (RESOLVE_SUFFIXES.stream().anyMatch(base::endsWith)) {
            candidates.add(base);
        }
        for (String suffix : RESOLVE_SUFFIXES) {
            candidates.add(base + suffix);
        }
        for (String suffix : RESOLVE_SUFFIXES) {
            candidates.add(base + "/index" + suffix);
        }
        for (String candidate : candidates) {
            if (host.fileExists(candidate)) {
                return host.getCanonicalFileName(candidate);
            }
        }
        return null;
    }

    private static String join(String containingFile, String specifier) {
        String prefix = "";
        String path = containingFile.replace('\\', '/');
        if (SourceLoader.isClasspath(path)) {
            prefix = SourceLoader.CLASSPATH_PREFIX;
            path = path.substring(prefix.length());
        }
        Path parent = Path.of(path).getParent();
        Path joined = parent == null ? Path.of(specifier) : parent.resolve(specifier);
        return prefix + joined.normalize().toString().replace('\\', '/');
    }

    private static Optional<String> fromClause(List<Token> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(TokenKind.OPEN_BRACE)) {
                depth++;
            } else if (t.is(TokenKind.CLOSE_BRACE)) {
                depth--;
            } else if (depth == 0 && t.is(TokenKind.FROM)) {
                return i + 1 < tokens.size() && tokens.get(i + 1).is(TokenKind.STRING)
                        ? Optional.of(unquote(tokens.get(i + 1).text()))
                        : Optional.empty();
            } else if (depth == 0 && (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.OPEN_PAREN)
                    || t.is(TokenKind.EQUALS) || t.kind().isKeyword() && !t.is(TokenKind.TYPE) && !t.is(TokenKind.AS))) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String unquote(String literal) {
        return literal.length() >= 2 ? literal.substring(1, literal.length() - 1) : literal;
    }
}
