package org.typeweave.compiler.frontend.preprocessor;

import org.typeweave.compiler.frontend.preprocessor.features.decorator.DecoratorRewriteExtension;
import org.typeweave.compiler.frontend.preprocessor.features.kind.KindAnnotationExtension;
import org.typeweave.compiler.frontend.preprocessor.features.operator.BinaryOperatorExtension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for syntax extensions, keyed by extension name.
 * Iteration follows registration order, which is the order extensions run in.
 */
public class SyntaxExtensionRegistry {

    private final Map<String, ISyntaxExtension> extensions = new LinkedHashMap<>();

    /**
     * Registers an extension under its own name.
     * @param extension The extension.
     * @throws IllegalArgumentException if another extension is already registered under that name.
     */
    public void register(ISyntaxExtension extension) {
        String name = extension.name();
        if (extensions.containsKey(name)) {
            throw new IllegalArgumentException("Syntax extension already registered: " + name);
        }
        extensions.put(name, extension);
    }

    /**
     * Looks up an extension by name.
     * @param name The extension name.
     * @return The extension, or empty if none is registered under this name.
     */
    public Optional<ISyntaxExtension> get(String name) {
        return Optional.ofNullable(extensions.get(name));
    }

    public Collection<ISyntaxExtension> all() {
        return extensions.values();
    }

    /**
     * Resolves the extensions enabled for a run.
     * @param names The names to enable in the given order, or null for all registered extensions.
     *              Unknown names are ignored.
     * @return The enabled extensions.
     */
    public List<ISyntaxExtension> select(List<String> names) {
        if (names == null) {
            return new ArrayList<>(extensions.values());
        }
        List<ISyntaxExtension> selected = new ArrayList<>();
        for (String name : names) {
            get(name).ifPresent(selected::add);
        }
        return selected;
    }

    /**
     * Creates a registry with all built-in extensions: kind annotations, decorator rewriting,
     * and the {@code |>} and {@code ::} operators.
     * @return A new registry instance.
     */
    public static SyntaxExtensionRegistry initialize() {
        SyntaxExtensionRegistry registry = new SyntaxExtensionRegistry();
        registry.register(new KindAnnotationExtension());
        registry.register(new DecoratorRewriteExtension());
        registry.register(BinaryOperatorExtension.pipeline());
        registry.register(BinaryOperatorExtension.cons());
        return registry;
    }
}
