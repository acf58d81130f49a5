package org.typeweave.compiler.frontend.preprocessor.features.kind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.frontend.preprocessor.IStructuralExtension;
import org.typeweave.compiler.frontend.preprocessor.Replacement;
import org.typeweave.compiler.frontend.preprocessor.RewriteMode;
import org.typeweave.compiler.frontend.preprocessor.RewriteOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites kind annotations on type parameters.
 * <p>
 * A type parameter written as {@code F<_>} (or {@code F<_, _>} for higher arities) stands for a type
 * constructor. The marker is stripped from the parameter list, and within the declaring scope every
 * application {@code F<A>} with the declared number of arguments becomes {@code Kind<F, A>}. Nested
 * applications compose, so {@code F<G<A>>} with both parameters marked becomes
 * {@code Kind<F, Kind<G, A>>}. Ordinary type parameters are never touched.
 */
public class KindAnnotationExtension implements IStructuralExtension {

    private static final Logger log = LoggerFactory.getLogger(KindAnnotationExtension.class);

    public static final String NAME = "kind";
    public static final String FORMAT_MARKER = " /*@kind*/";
    private static final String PLACEHOLDER = "_";

    private record Declaration(String param, int arity, int markerStart, int markerEnd, int scopeStart, int scopeEnd) {
        boolean covers(int position) {
            return position >= scopeStart && position <= scopeEnd;
        }
    }

    private record Application(String param, int identIndex, int openIndex, int closeIndex,
                               List<int[]> argRanges) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Replacement> rewrite(TokenStream stream, String source, RewriteOptions options) {
        List<Declaration> declarations = findDeclarations(stream);
        if (declarations.isEmpty()) {
            return List.of();
        }
        List<Application> applications = findApplications(stream, declarations);

        List<Replacement> replacements = new ArrayList<>();
        String markerText = options.mode() == RewriteMode.FORMAT ? FORMAT_MARKER : "";
        for (Declaration declaration : declarations) {
            replacements.add(new Replacement(declaration.markerStart(), declaration.markerEnd(), markerText));
        }
        for (Application application : applications) {
            if (enclosing(applications, application) == null) {
                int start = stream.get(application.identIndex()).start();
                int end = stream.get(application.closeIndex()).end();
                replacements.add(new Replacement(start, end, render(stream, application, applications)));
            }
        }
        replacements.sort(Comparator.comparingInt(Replacement::start));
        return replacements;
    }

    /**
     * Finds every {@code Name<_, ...>} marker whose name starts with an uppercase letter.
     */
    private List<Declaration> findDeclarations(TokenStream stream) {
        List<Declaration> declarations = new ArrayList<>();
        for (int i = 0; i + 3 < stream.size(); i++) {
            Token name = stream.get(i);
            if (name.kind() != TokenKind.IDENTIFIER || !Character.isUpperCase(name.text().charAt(0))
                    || stream.get(i + 1).kind() != TokenKind.LESS_THAN) {
                continue;
            }
            int j = i + 2;
            int arity = 0;
            boolean expectPlaceholder = true;
            Token close = null;
            while (j < stream.size()) {
                Token t = stream.get(j);
                if (expectPlaceholder) {
                    if (t.kind() != TokenKind.IDENTIFIER || !t.text().equals(PLACEHOLDER)) {
                        break;
                    }
                    arity++;
                    expectPlaceholder = false;
                } else if (t.kind() == TokenKind.COMMA) {
                    expectPlaceholder = true;
                } else {
                    if (t.kind() == TokenKind.GREATER_THAN) {
                        close = t;
                    }
                    break;
                }
                j++;
            }
            if (close == null) {
                continue;
            }
            int list = openingTypeParameterList(stream, i);
            if (list < 0 || stream.findMatchingAngle(list) < 0) {
                log.debug("Leaving {} at offset {} untouched: not inside a closed type parameter list",
                        name.text(), name.start());
                continue;
            }
            int[] scope = enclosingScope(stream, i);
            declarations.add(new Declaration(name.text(), arity, stream.get(i + 1).start(), close.end(),
                    scope[0], scope[1]));
            log.debug("Kind parameter {} of arity {} scoped to [{}, {})", name.text(), arity, scope[0], scope[1]);
            i = j;
        }
        return declarations;
    }

    /**
     * Walks back from a type parameter to the {@code <} that opens its list.
     * @return The token index of that {@code <}, or -1 if the parameter is not inside one.
     */
    private static int openingTypeParameterList(TokenStream stream, int nameIndex) {
        int depth = 0;
        for (int i = nameIndex - 1; i >= 0; i--) {
            Token t = stream.get(i);
            if (t.kind() == TokenKind.GREATER_THAN || TokenStream.isCloseBracket(t)) {
                depth++;
            } else if (t.kind() == TokenKind.LESS_THAN || TokenStream.isOpenBracket(t)) {
                if (depth == 0) {
                    return t.kind() == TokenKind.LESS_THAN ? i : -1;
                }
                depth--;
            } else if (depth == 0 && t.kind() == TokenKind.SEMICOLON) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * The scope of a declaration opens at the brace enclosing it (or the file start) and closes at the end
     * of the first body that follows, or at the terminating semicolon of a brace-less declaration.
     */
    private static int[] enclosingScope(TokenStream stream, int paramIndex) {
        int depth = 0;
        int start = 0;
        for (int i = paramIndex - 1; i >= 0; i--) {
            Token t = stream.get(i);
            if (t.kind() == TokenKind.CLOSE_BRACE) {
                depth++;
            } else if (t.kind() == TokenKind.OPEN_BRACE) {
                if (depth == 0) {
                    start = t.start();
                    break;
                }
                depth--;
            }
        }

        int braces = 0;
        int parens = 0;
        boolean bodySeen = false;
        int end = stream.size() == 0 ? 0 : stream.get(stream.size() - 1).end();
        for (int i = paramIndex; i < stream.size(); i++) {
            Token t = stream.get(i);
            if (t.kind() == TokenKind.OPEN_BRACE) {
                braces++;
                bodySeen = true;
            } else if (t.kind() == TokenKind.CLOSE_BRACE) {
                if (braces <= 1) {
                    end = t.end();
                    break;
                }
                braces--;
            } else if (t.kind() == TokenKind.OPEN_PAREN) {
                parens++;
            } else if (t.kind() == TokenKind.CLOSE_PAREN && parens > 0) {
                parens--;
            } else if (!bodySeen && parens == 0 && t.kind() == TokenKind.SEMICOLON) {
                end = t.end();
                break;
            }
        }
        return new int[]{start, end};
    }

    private List<Application> findApplications(TokenStream stream, List<Declaration> declarations) {
        List<Application> applications = new ArrayList<>();
        for (int i = 0; i + 1 < stream.size(); i++) {
            Token ident = stream.get(i);
            if (ident.kind() != TokenKind.IDENTIFIER || stream.get(i + 1).kind() != TokenKind.LESS_THAN) {
                continue;
            }
            Declaration declaration = activeDeclaration(declarations, ident.text(), ident.start());
            if (declaration == null) {
                continue;
            }
            int close = stream.findMatchingAngle(i + 1);
            if (close < 0 || close == i + 2) {
                continue;
            }
            if (onlyPlaceholders(stream, i + 2, close - 1)) {
                continue;
            }
            List<int[]> args = splitArguments(stream, i + 2, close - 1);
            if (args.size() != declaration.arity()) {
                log.debug("Leaving {} at offset {} untouched: {} argument(s) for a kind of arity {}",
                        ident.text(), ident.start(), args.size(), declaration.arity());
                continue;
            }
            applications.add(new Application(ident.text(), i, i + 1, close, args));
        }
        return applications;
    }

    /**
     * Shadowing: the declaration with the smallest scope covering the position wins.
     */
    private static Declaration activeDeclaration(List<Declaration> declarations, String param, int position) {
        Declaration best = null;
        for (Declaration d : declarations) {
            if (!d.param().equals(param) || !d.covers(position)) {
                continue;
            }
            if (best == null || d.scopeEnd() - d.scopeStart() < best.scopeEnd() - best.scopeStart()) {
                best = d;
            }
        }
        return best;
    }

    private static boolean onlyPlaceholders(TokenStream stream, int from, int to) {
        for (int i = from; i <= to; i++) {
            Token t = stream.get(i);
            boolean placeholder = t.kind() == TokenKind.IDENTIFIER && t.text().equals(PLACEHOLDER);
            if (!placeholder && t.kind() != TokenKind.COMMA) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits the token range of a type argument list at top-level commas.
     * @return Inclusive token index ranges, one per argument.
     */
    private static List<int[]> splitArguments(TokenStream stream, int from, int to) {
        List<int[]> ranges = new ArrayList<>();
        int depth = 0;
        int argStart = from;
        for (int i = from; i <= to; i++) {
            Token t = stream.get(i);
            if (TokenStream.isOpenBracket(t) || t.kind() == TokenKind.LESS_THAN) {
                depth++;
            } else if (TokenStream.isCloseBracket(t) || t.kind() == TokenKind.GREATER_THAN) {
                depth--;
            } else if (depth == 0 && t.kind() == TokenKind.COMMA) {
                if (i > argStart) {
                    ranges.add(new int[]{argStart, i - 1});
                }
                argStart = i + 1;
            }
        }
        if (argStart <= to) {
            ranges.add(new int[]{argStart, to});
        }
        return ranges;
    }

    private static Application enclosing(List<Application> applications, Application inner) {
        Application best = null;
        for (Application other : applications) {
            if (other != inner && other.openIndex() < inner.identIndex() && other.closeIndex() > inner.closeIndex()) {
                if (best == null || other.identIndex() > best.identIndex()) {
                    best = other;
                }
            }
        }
        return best;
    }

    private String render(TokenStream stream, Application application, List<Application> applications) {
        List<String> args = new ArrayList<>(application.argRanges().size());
        for (int[] range : application.argRanges()) {
            args.add(renderRange(stream, range[0], range[1], application, applications).strip());
        }
        return "Kind<" + application.param() + ", " + String.join(", ", args) + ">";
    }

    /**
     * Renders the source of a token range, substituting the applications directly nested in {@code owner}.
     */
    private String renderRange(TokenStream stream, int from, int to, Application owner,
                               List<Application> applications) {
        String source = stream.source();
        int rangeEnd = stream.get(to).end();
        int position = stream.get(from).start();
        StringBuilder sb = new StringBuilder();
        for (Application nested : applications) {
            if (nested.identIndex() < from || nested.closeIndex() > to || enclosing(applications, nested) != owner) {
                continue;
            }
            int nestedStart = stream.get(nested.identIndex()).start();
            sb.append(source, position, nestedStart).append(render(stream, nested, applications));
            position = stream.get(nested.closeIndex()).end();
        }
        sb.append(source, position, rangeEnd);
        return sb.toString();
    }
}
