package org.typeweave.compiler.frontend.preprocessor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.frontend.lexer.CustomOperatorDef;
import org.typeweave.compiler.frontend.lexer.TokenStream;
import org.typeweave.compiler.sourcemap.SourceMap;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the two-phase preprocessor: built-in extensions, extension selection, idempotence and source maps.
 */
public class PreProcessorTest {

    /** A structural extension that proposes a fixed list of replacements. */
    private record FixedReplacements(String name, List<Replacement> replacements) implements IStructuralExtension {
        @Override
        public List<Replacement> rewrite(TokenStream stream, String source, RewriteOptions options) {
            return replacements;
        }
    }

    private final PreProcessor preProcessor = new PreProcessor();

    @Test
    @Tag("unit")
    void sourceWithoutExtendedSyntaxIsReturnedUnchanged() {
        String source = "const x: Array<number> = [1, 2];\nfunction f(a: number) { return a > 1 ? a : -a; }\n";

        PreprocessResult result = preProcessor.preprocess(source, PreprocessOptions.defaults());

        assertThat(result.changed()).isFalse();
        assertThat(result.code()).isSameAs(source);
        assertThat(result.map()).isNull();
    }

    @Test
    @Tag("unit")
    void preprocessingIsIdempotentOnItsOwnOutput() {
        PreprocessResult first = preProcessor.preprocess("const y = x |> f |> g;", PreprocessOptions.defaults());

        PreprocessResult second = preProcessor.preprocess(first.code(), PreprocessOptions.defaults());

        assertThat(first.changed()).isTrue();
        assertThat(second.changed()).isFalse();
        assertThat(second.code()).isEqualTo(first.code());
    }

    @Test
    @Tag("unit")
    void builtinOperatorsRewriteToTheDispatcher() {
        PreprocessResult result = preProcessor.preprocess("const y = x |> f;\nconst l = 1 :: 2 :: rest;",
                PreprocessOptions.defaults());

        assertThat(result.code()).isEqualTo(
                "const y = __binop__(x, \"|>\", f);\nconst l = __binop__(1, \"::\", __binop__(2, \"::\", rest));");
    }

    @Test
    @Tag("unit")
    void operatorsInBothBranchesOfAConditionalAreRewritten() {
        // Act
        PreprocessResult result = preProcessor.preprocess("const r = ok ? xs |> f : ys |> g;", PreprocessOptions.defaults());

        // Assert
        assertThat(result.code()).isEqualTo("const r = ok ? __binop__(xs, \"|>\", f) : __binop__(ys, \"|>\", g);");
        assertThat(result.code()).doesNotContain(" |> ");
    }

    @Test
    @Tag("unit")
    void structuralAndOperatorPhasesCombine() {
        // Arrange
        String source = "@instance(\"Show<Num>\")\nconst show = n |> toText;";

        // Act
        PreprocessResult result = preProcessor.preprocess(source, PreprocessOptions.defaults());

        // Assert
        assertThat(result.code()).isEqualTo("\nconst show = instance(\"Show<Num>\", __binop__(n, \"|>\", toText));");
    }

    @Test
    @Tag("unit")
    void mapResolvesUntouchedTextExactlyAndRewrittenTextIntoItsOriginalSpan() {
        // Arrange
        String source = "const y = x |> f;";
        PreprocessResult result = preProcessor.preprocess(source, PreprocessOptions.defaults());
        SourceMap map = result.map();
        String code = result.code();

        // Act / Assert
        assertThat(map.originalOffsetFor(code.indexOf('y'))).isEqualTo(source.indexOf('y'));
        assertThat(map.originalOffsetFor(code.length() - 1)).isEqualTo(source.length() - 1);
        int rewrittenStart = source.indexOf('x');
        int rewrittenEnd = source.indexOf(';');
        for (int offset = code.indexOf("__binop__"); offset < code.length() - 1; offset++) {
            assertThat(map.originalOffsetFor(offset)).isBetween(rewrittenStart, rewrittenEnd);
        }
    }

    @Test
    @Tag("unit")
    void onlySelectedExtensionsRun() {
        PreprocessOptions onlyPipeline = PreprocessOptions.defaults().withExtensions(List.of("pipeline"));

        PreprocessResult result = preProcessor.preprocess("const a = x |> f; const b = 1 :: rest;", onlyPipeline);

        assertThat(result.code()).isEqualTo("const a = __binop__(x, \"|>\", f); const b = 1 :: rest;");
    }

    @Test
    @Tag("unit")
    void customOperatorExtensionsRunAfterBuiltins() {
        PreprocessOptions options = PreprocessOptions.defaults()
                .withExtensions(List.of())
                .withCustomExtensions(List.of(InfixCall.left("+", 1, "add"), InfixCall.left("*", 2, "mul")));

        PreprocessResult result = preProcessor.preprocess("let v = a + b * c;", options);

        assertThat(result.code()).isEqualTo("let v = add(a, mul(b, c));");
    }

    @Test
    @Tag("unit")
    void overlappingStructuralReplacementIsDropped() {
        // Arrange
        PreprocessOptions options = PreprocessOptions.defaults()
                .withExtensions(List.of())
                .withCustomExtensions(List.of(
                        new FixedReplacements("first", List.of(new Replacement(0, 3, "AAA"))),
                        new FixedReplacements("second", List.of(new Replacement(1, 4, "BBB")))));

        // Act
        PreprocessResult result = preProcessor.preprocess("abcdef", options);

        // Assert
        assertThat(result.code()).isEqualTo("AAAdef");
    }

    @Test
    @Tag("unit")
    void formatModeLeavesKindMarkerComment() {
        PreprocessOptions options = PreprocessOptions.defaults().withMode(RewriteMode.FORMAT);

        PreprocessResult result = preProcessor.preprocess("interface Functor<F<_>> { map(fa: F<number>): void; }", options);

        assertThat(result.code()).isEqualTo("interface Functor<F /*@kind*/> { map(fa: Kind<F, number>): void; }");
    }

    @Test
    @Tag("unit")
    void operatorDefinitionsFollowTheSelection() {
        List<CustomOperatorDef> all = preProcessor.operatorDefinitions(PreprocessOptions.defaults());
        List<CustomOperatorDef> none = preProcessor.operatorDefinitions(
                PreprocessOptions.defaults().withExtensions(List.of("kind")));

        assertThat(all).extracting(CustomOperatorDef::symbol).containsExactly("|>", "::");
        assertThat(none).isEmpty();
    }
}
