package org.typeweave.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares a character sequence that the scanner must recognize as one operator token.
 *
 * @param symbol     The operator symbol, e.g. {@code |>}.
 * @param characters The characters making up the symbol, in order.
 */
public record CustomOperatorDef(String symbol, List<String> characters) {

    public CustomOperatorDef {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("Custom operator symbol must not be empty");
        }
        characters = List.copyOf(characters);
    }

    /**
     * Creates a definition whose characters are the individual characters of the symbol.
     * @param symbol The operator symbol.
     * @return The definition.
     */
    public static CustomOperatorDef of(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("Custom operator symbol must not be empty");
        }
        List<String> chars = new ArrayList<>();
        for (char c : symbol.toCharArray()) {
            chars.add(String.valueOf(c));
        }
        return new CustomOperatorDef(symbol, chars);
    }
}
