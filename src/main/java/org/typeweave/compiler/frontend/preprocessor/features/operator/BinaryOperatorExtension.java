package org.typeweave.compiler.frontend.preprocessor.features.operator;

import org.typeweave.compiler.frontend.preprocessor.Associativity;
import org.typeweave.compiler.frontend.preprocessor.ICustomOperatorExtension;

/**
 * A custom operator that lowers each application to a call of the runtime dispatcher
 * {@code __binop__(left, "symbol", right)}, which resolves the operator against the operand types.
 *
 * @param name          The registration name.
 * @param symbol        The operator symbol.
 * @param precedence    The precedence rank.
 * @param associativity The associativity.
 */
public record BinaryOperatorExtension(String name, String symbol, int precedence, Associativity associativity)
        implements ICustomOperatorExtension {

    public static final String DISPATCHER = "__binop__";

    public BinaryOperatorExtension {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Operator symbol must not be blank");
        }
        if (associativity == null) {
            throw new IllegalArgumentException("Associativity must not be null for operator " + symbol);
        }
    }

    /**
     * The pipeline operator: {@code x |> f} passes {@code x} to {@code f}.
     */
    public static BinaryOperatorExtension pipeline() {
        return new BinaryOperatorExtension("pipeline", "|>", 1, Associativity.LEFT);
    }

    /**
     * The cons operator: {@code head :: tail} prepends to a list.
     */
    public static BinaryOperatorExtension cons() {
        return new BinaryOperatorExtension("cons", "::", 5, Associativity.RIGHT);
    }

    @Override
    public String transform(String left, String right) {
        return DISPATCHER + "(" + left + ", \"" + symbol + "\", " + right + ")";
    }
}
