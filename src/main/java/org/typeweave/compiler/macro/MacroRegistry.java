package org.typeweave.compiler.macro;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for expression macros, keyed by callee name. Iteration follows registration order.
 */
public class MacroRegistry {

    private final Map<String, IExpressionMacro> macros = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if another macro is already registered under the same name.
     */
    public void register(IExpressionMacro macro) {
        String name = macro.name();
        if (macros.containsKey(name)) {
            throw new IllegalArgumentException("Macro already registered: " + name);
        }
        macros.put(name, macro);
    }

    public Optional<IExpressionMacro> get(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public boolean contains(String name) {
        return macros.containsKey(name);
    }

    public Set<String> names() {
        return macros.keySet();
    }

    public Collection<IExpressionMacro> all() {
        return macros.values();
    }

    public boolean isEmpty() {
        return macros.isEmpty();
    }
}
