package org.typeweave.compiler.pipeline;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.frontend.preprocessor.RewriteMode;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests that default session options follow the layered configuration.
 */
public class PipelineOptionsTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("typeweave.cache.max-size");
        System.clearProperty("typeweave.preprocessor.mode");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void defaultsMirrorTheReferenceConfiguration() {
        PipelineOptions options = PipelineOptions.defaults();

        assertThat(options.cacheMaxSize()).isEqualTo(1000);
        assertThat(options.maxExpansionPasses()).isEqualTo(8);
        assertThat(options.preprocessOptions().mode()).isEqualTo(RewriteMode.MACRO);
        assertThat(options.preprocessOptions().extensions()).containsExactly("kind", "decorator-rewrite", "pipeline", "cons");
        assertThat(options.hostOptions().shouldPreprocess("src/types.d.ts")).isFalse();
        assertThat(options.macros().isEmpty()).isTrue();
        assertThat(options.rootFiles()).isEmpty();
    }

    @Test
    @Tag("unit")
    void systemPropertiesReachTheDefaultsAndInMemoryTransforms() {
        // Arrange
        System.setProperty("typeweave.cache.max-size", "42");
        System.setProperty("typeweave.preprocessor.mode", "format");
        ConfigFactory.invalidateCaches();

        // Act
        PipelineOptions options = PipelineOptions.defaults();
        TransformResult result = TransformationPipeline.transformCode(
                "interface Functor<F<_>> { map(fa: F<number>): void; }", "functor.ts");

        // Assert
        assertThat(options.cacheMaxSize()).isEqualTo(42);
        assertThat(options.preprocessOptions().mode()).isEqualTo(RewriteMode.FORMAT);
        assertThat(result.code()).isEqualTo("interface Functor<F /*@kind*/> { map(fa: Kind<F, number>): void; }");
    }
}
