package org.typeweave.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.frontend.preprocessor.RewriteMode;
import org.typeweave.compiler.macro.MacroRegistry;
import org.typeweave.compiler.pipeline.PipelineOptions;

import java.io.File;
import java.net.URISyntaxException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the typed view of the configuration and its conversion into session options.
 */
public class PipelineConfigTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    private File resource(String name) throws URISyntaxException {
        return new File(getClass().getResource(name).toURI());
    }

    @Test
    @Tag("unit")
    void readsTheReferenceDefaults() {
        // Act
        PipelineConfig config = PipelineConfig.fromConfig(ConfigLoader.loadDefaults());

        // Assert
        assertThat(config.extensions()).containsExactly("kind", "decorator-rewrite", "pipeline", "cons");
        assertThat(config.mode()).isEqualTo(RewriteMode.MACRO);
        assertThat(config.maxOperatorIterations()).isEqualTo(1000);
        assertThat(config.cacheMaxSize()).isEqualTo(1000);
        assertThat(config.preprocessExtensions()).containsExactly(".ts", ".tsx", ".js", ".jsx");
        assertThat(config.excludedPathSegments()).containsExactly("node_modules");
        assertThat(config.declarationSuffix()).isEqualTo(".d.ts");
        assertThat(config.maxExpansionPasses()).isEqualTo(8);
    }

    @Test
    @Tag("unit")
    void convertsIntoSessionOptions() throws URISyntaxException {
        // Arrange
        PipelineConfig config = PipelineConfig.fromConfig(ConfigLoader.loadFromFile(resource("test-config.conf")));
        MacroRegistry macros = new MacroRegistry();

        // Act
        PipelineOptions options = config.toPipelineOptions(macros, List.of("src/main.ts"));

        // Assert
        assertThat(options.preprocessOptions().extensions()).containsExactly("pipeline");
        assertThat(options.preprocessOptions().mode()).isEqualTo(RewriteMode.FORMAT);
        assertThat(options.cacheMaxSize()).isEqualTo(50);
        assertThat(options.maxExpansionPasses()).isEqualTo(50);
        assertThat(options.hostOptions().shouldPreprocess("src/main.ts")).isTrue();
        assertThat(options.macros()).isSameAs(macros);
        assertThat(options.rootFiles()).containsExactly("src/main.ts");
    }

    @Test
    @Tag("unit")
    void rejectsUnknownModesAndNonPositiveLimits() throws URISyntaxException {
        Config badMode = ConfigLoader.loadFromFile(resource("bad-mode.conf"));
        Config zeroCache = ConfigFactory.parseString("typeweave.cache.max-size = 0")
                .withFallback(ConfigLoader.loadDefaults());

        assertThatThrownBy(() -> PipelineConfig.fromConfig(badMode))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown rewrite mode 'pretty', expected macro or format");
        assertThatThrownBy(() -> PipelineConfig.fromConfig(zeroCache))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cache.max-size");
    }

    @Test
    @Tag("unit")
    void modeIsCaseInsensitive() {
        Config config = ConfigFactory.parseString("typeweave.preprocessor.mode = \" Format \"")
                .withFallback(ConfigLoader.loadDefaults());

        assertThat(PipelineConfig.fromConfig(config).mode()).isEqualTo(RewriteMode.FORMAT);
    }
}
