package org.typeweave.compiler.frontend.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeweave.compiler.frontend.lexer.CustomOperatorDef;
import org.typeweave.compiler.frontend.lexer.Scanner;
import org.typeweave.compiler.frontend.lexer.ScannerOptions;
import org.typeweave.compiler.frontend.lexer.Token;
import org.typeweave.compiler.frontend.lexer.TokenKind;
import org.typeweave.compiler.frontend.lexer.TokenStream;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites custom operator applications into host-language text, one application per iteration.
 * <p>
 * Each iteration classifies the current tokens with a {@link TypeContextTracker}, selects the next
 * application (highest precedence first; leftmost for left-associative, rightmost for right-associative
 * operators), determines its operand extents, and splices the operator's transform over them. Only the
 * tokens of the spliced text are rescanned; later tokens are shifted. Operands stop at boundary tokens,
 * unmatched brackets, and at any other custom operator of lower or equal precedence, which reproduces
 * the partitioning of a precedence-climbing parser.
 * <p>
 * An application whose operands cannot be determined is left untouched and the scan continues with
 * the remaining candidates. The number of iterations is capped.
 */
public class OperatorRewriter {

    private static final Logger log = LoggerFactory.getLogger(OperatorRewriter.class);

    /**
     * The result of a rewrite.
     *
     * @param code         The rewritten text.
     * @param changed      true if at least one application was rewritten.
     * @param replacements The net effect as replacements over the input text.
     * @param rewrites     The number of applications rewritten.
     * @param abandoned    The number of applications left untouched because their operands were ambiguous.
     * @param capReached   true if the iteration cap stopped the rewrite.
     */
    public record Result(String code, boolean changed, List<Replacement> replacements,
                         int rewrites, int abandoned, boolean capReached) {
    }

    private record Occurrence(int tokenIndex, ICustomOperatorExtension operator, Token token) {
    }

    private final Map<String, ICustomOperatorExtension> operators = new LinkedHashMap<>();
    private final ScannerOptions scannerOptions;
    private final int maxIterations;
    private final TypeContextTracker tracker = new TypeContextTracker();

    /**
     * Creates a rewriter for a set of operators.
     * @param operators     The operator extensions; later registrations of a symbol are ignored.
     * @param scannerOptions The scanner options; its custom operators should cover every operator symbol.
     * @param maxIterations The iteration cap.
     */
    public OperatorRewriter(List<ICustomOperatorExtension> operators, ScannerOptions scannerOptions, int maxIterations) {
        for (ICustomOperatorExtension op : operators) {
            this.operators.putIfAbsent(op.symbol(), op);
        }
        this.scannerOptions = scannerOptions;
        this.maxIterations = maxIterations;
    }

    /**
     * Creates a rewriter whose scanner recognizes exactly the given operators.
     * @param operators     The operator extensions.
     * @param fileName      The file name for grammar variant selection, may be null.
     * @param maxIterations The iteration cap.
     * @return The rewriter.
     */
    public static OperatorRewriter forOperators(List<ICustomOperatorExtension> operators, String fileName,
                                                int maxIterations) {
        List<CustomOperatorDef> defs = operators.stream().map(op -> CustomOperatorDef.of(op.symbol())).toList();
        return new OperatorRewriter(operators, ScannerOptions.forFile(defs, fileName), maxIterations);
    }

    /**
     * Rewrites all custom operator applications in a text.
     * @param source The text.
     * @return The rewrite result.
     */
    public Result rewrite(String source) {
        List<Token> tokens = new ArrayList<>(Scanner.tokenize(source, scannerOptions));
        SpliceLog spliceLog = new SpliceLog(source);
        Set<Integer> abandonedStarts = new HashSet<>();
        String text = source;
        int iterations = 0;
        int rewrites = 0;
        boolean capReached = false;

        while (true) {
            List<Occurrence> candidates = findCandidates(tokens, abandonedStarts);
            if (candidates.isEmpty()) {
                break;
            }
            if (iterations >= maxIterations) {
                capReached = true;
                log.warn("Operator rewriting stopped after {} iterations with {} application(s) left",
                        maxIterations, candidates.size());
                break;
            }
            iterations++;

            Occurrence selected = selectNext(candidates);
            int opIndex = selected.tokenIndex();
            ICustomOperatorExtension operator = selected.operator();
            int leftIndex = findLeftBoundary(tokens, text, opIndex, operator.precedence());
            int rightIndex = findRightBoundary(tokens, opIndex, operator.precedence());

            if (leftIndex >= opIndex || rightIndex <= opIndex) {
                abandon(abandonedStarts, selected, "operand missing");
                continue;
            }

            int leftStart = tokens.get(leftIndex).start();
            int rightEnd = tokens.get(rightIndex).end();
            String left = text.substring(leftStart, selected.token().start()).strip();
            String right = text.substring(selected.token().end(), rightEnd).strip();

            String transformed;
            try {
                transformed = operator.transform(left, right);
            } catch (RuntimeException e) {
                log.warn("Operator '{}' failed to transform '{}' and '{}': {}",
                        operator.symbol(), left, right, e.getMessage());
                abandon(abandonedStarts, selected, "transform failed");
                continue;
            }
            if (transformed == null) {
                abandon(abandonedStarts, selected, "transform returned null");
                continue;
            }

            text = text.substring(0, leftStart) + transformed + text.substring(rightEnd);
            spliceLog.splice(leftStart, rightEnd, transformed);
            int delta = transformed.length() - (rightEnd - leftStart);
            retokenize(tokens, leftIndex, rightIndex, transformed, leftStart, delta);
            shiftAbandoned(abandonedStarts, leftStart, rightEnd, delta);
            rewrites++;
        }

        return new Result(text, rewrites > 0, rewrites > 0 ? spliceLog.toReplacements() : List.of(),
                rewrites, abandonedStarts.size(), capReached);
    }

    private List<Occurrence> findCandidates(List<Token> tokens, Set<Integer> abandonedStarts) {
        List<TypeContextTracker.Context> contexts = tracker.classify(tokens);
        List<Occurrence> occurrences = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isCustomOperator() || contexts.get(i).isTypeContext()
                    || abandonedStarts.contains(token.start())) {
                continue;
            }
            ICustomOperatorExtension op = operators.get(token.text());
            if (op != null) {
                occurrences.add(new Occurrence(i, op, token));
            }
        }
        return occurrences;
    }

    private static Occurrence selectNext(List<Occurrence> candidates) {
        int highest = Integer.MIN_VALUE;
        for (Occurrence o : candidates) {
            highest = Math.max(highest, o.operator().precedence());
        }
        Occurrence first = null;
        Occurrence last = null;
        for (Occurrence o : candidates) {
            if (o.operator().precedence() == highest) {
                if (first == null) {
                    first = o;
                }
                last = o;
            }
        }
        return first.operator().associativity() == Associativity.LEFT ? first : last;
    }

    private int findLeftBoundary(List<Token> tokens, String text, int operatorIndex, int precedence) {
        int depth = 0;
        for (int i = operatorIndex - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (depth == 0 && endsStatementBlock(tokens, text, i, operatorIndex)) {
                return i + 1;
            }
            if (TokenStream.isCloseBracket(token)) {
                depth++;
                continue;
            }
            if (TokenStream.isOpenBracket(token)) {
                if (depth > 0) {
                    depth--;
                    continue;
                }
                return i + 1;
            }
            if (depth > 0) {
                continue;
            }
            if (token.kind() == TokenKind.TEMPLATE_MIDDLE || endsOperandLeftward(tokens, i)
                    || stopsAt(token, precedence)) {
                return i + 1;
            }
        }
        return 0;
    }

    private int findRightBoundary(List<Token> tokens, int operatorIndex, int precedence) {
        int depth = 0;
        int lastValid = operatorIndex;
        for (int i = operatorIndex + 1; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (TokenStream.isOpenBracket(token)) {
                depth++;
                lastValid = i;
                continue;
            }
            if (TokenStream.isCloseBracket(token)) {
                if (depth > 0) {
                    depth--;
                    lastValid = i;
                    continue;
                }
                return lastValid;
            }
            if (depth == 0 && (token.kind() == TokenKind.TEMPLATE_MIDDLE
                    || TokenStream.isBoundaryAt(tokens, i) || stopsAt(token, precedence))) {
                return lastValid;
            }
            lastValid = i;
        }
        return lastValid;
    }

    /**
     * A closing brace that ends its line closes the preceding statement, unless the operator itself
     * continues that line.
     */
    private static boolean endsStatementBlock(List<Token> tokens, String text, int index, int operatorIndex) {
        Token token = tokens.get(index);
        if (token.kind() != TokenKind.CLOSE_BRACE || index + 1 >= operatorIndex) {
            return false;
        }
        return text.substring(token.end(), tokens.get(index + 1).start()).indexOf('\n') >= 0;
    }

    /**
     * A left operand also ends at {@code else}, {@code do} and {@code of}.
     */
    private static boolean endsOperandLeftward(List<Token> tokens, int index) {
        if (TokenStream.isBoundaryAt(tokens, index)) {
            return true;
        }
        Token token = tokens.get(index);
        if (token.kind() == TokenKind.KEYWORD) {
            String text = token.text();
            return text.equals("else") || text.equals("do") || text.equals("of");
        }
        return false;
    }

    private boolean stopsAt(Token token, int precedence) {
        if (!token.isCustomOperator()) {
            return false;
        }
        ICustomOperatorExtension other = operators.get(token.text());
        return other != null && other.precedence() <= precedence;
    }

    private void retokenize(List<Token> tokens, int fromIndex, int toIndex, String replacementText,
                            int offset, int delta) {
        List<Token> fresh = Scanner.tokenize(replacementText, scannerOptions);
        tokens.subList(fromIndex, toIndex + 1).clear();
        for (int i = fromIndex; i < tokens.size(); i++) {
            tokens.set(i, tokens.get(i).shift(delta));
        }
        List<Token> shifted = new ArrayList<>(fresh.size());
        for (Token t : fresh) {
            shifted.add(t.shift(offset));
        }
        tokens.addAll(fromIndex, shifted);
    }

    private static void shiftAbandoned(Set<Integer> abandoned, int start, int end, int delta) {
        if (abandoned.isEmpty()) {
            return;
        }
        Set<Integer> updated = new HashSet<>();
        for (int position : abandoned) {
            if (position < start) {
                updated.add(position);
            } else if (position >= end) {
                updated.add(position + delta);
            }
        }
        abandoned.clear();
        abandoned.addAll(updated);
    }

    private static void abandon(Set<Integer> abandoned, Occurrence occurrence, String reason) {
        abandoned.add(occurrence.token().start());
        log.warn("Leaving '{}' at offset {} unrewritten: {}",
                occurrence.operator().symbol(), occurrence.token().start(), reason);
    }
}
