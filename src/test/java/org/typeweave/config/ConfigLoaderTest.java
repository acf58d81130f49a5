package org.typeweave.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("typeweave.cache.max-size");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadDefaults should expose the reference defaults")
    void loadDefaults_shouldExposeReferenceDefaults() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(1000, config.getInt("typeweave.cache.max-size"));
        assertEquals("macro", config.getString("typeweave.preprocessor.mode"));
        assertEquals(List.of("kind", "decorator-rewrite", "pipeline", "cons"),
                config.getStringList("typeweave.preprocessor.extensions"));
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the defaults")
    void loadFromFile_shouldMergeFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(50, config.getInt("typeweave.cache.max-size"));
        assertEquals("format", config.getString("typeweave.preprocessor.mode"));
        assertEquals(1000, config.getInt("typeweave.preprocessor.max-operator-iterations"));
        assertEquals(".d.ts", config.getString("typeweave.host.declaration-suffix"));
    }

    @Test
    @DisplayName("System property should override the file and reach substitutions")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("typeweave.cache.max-size", "7");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(7, config.getInt("typeweave.cache.max-size"));
        assertEquals(7, config.getInt("typeweave.macros.max-expansion-passes"));
        assertEquals("format", config.getString("typeweave.preprocessor.mode"));
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertEquals(50, config.getInt("typeweave.cache.max-size"));
        assertEquals(List.of("INFO Using configuration file " + file.getAbsolutePath()), messages);
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/typeweave.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("resolve should honor -Dconfig.file and reject a missing one")
    void resolve_shouldHonorConfigFileProperty() {
        List<ConfigLoader.MessageLevel> levels = new ArrayList<>();
        System.setProperty("config.file", testResource("test-config.conf").getPath());

        Config config = ConfigLoader.resolve(null, (level, message) -> levels.add(level));

        assertEquals("format", config.getString("typeweave.preprocessor.mode"));
        assertEquals(List.of(ConfigLoader.MessageLevel.INFO), levels);

        System.setProperty("config.file", "does-not-exist.conf");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null, (level, message) -> { }));
    }

    @Test
    @DisplayName("resolve should fall back to classpath defaults with a warning")
    void resolve_shouldFallBackToDefaultsWithWarning() {
        List<ConfigLoader.MessageLevel> levels = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> levels.add(level));

        assertEquals(1000, config.getInt("typeweave.cache.max-size"));
        assertEquals(List.of(ConfigLoader.MessageLevel.WARN), levels);
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid test resource URL: " + url, e);
        }
    }
}
