package org.typeweave.compiler.host;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests file access of the filesystem host against a temporary directory.
 */
public class FileSystemCompilerHostTest {

    @TempDir
    Path root;

    @Test
    @Tag("integration")
    void readsRelativeNamesAgainstTheCurrentDirectoryWithNormalizedLineEndings() throws IOException {
        // Arrange
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/a.ts"), "const a = 1;\r\nconst b = 2;\r\n", StandardCharsets.UTF_8);
        FileSystemCompilerHost host = new FileSystemCompilerHost(root);

        // Act
        String text = host.readFile("src/a.ts");
        SourceFile file = host.getSourceFile("./src/../src/a.ts");

        // Assert
        assertThat(text).isEqualTo("const a = 1;\nconst b = 2;\n");
        assertThat(file).isNotNull();
        assertThat(file.preprocessed()).isFalse();
        assertThat(file.map()).isNull();
        assertThat(file.fileName()).isEqualTo(host.getCanonicalFileName("src/a.ts"));
        assertThat(host.fileExists("src/a.ts")).isTrue();
    }

    @Test
    @Tag("integration")
    void missingFilesYieldNull() {
        FileSystemCompilerHost host = new FileSystemCompilerHost(root);

        assertThat(host.readFile("missing.ts")).isNull();
        assertThat(host.getSourceFile("missing.ts")).isNull();
        assertThat(host.fileExists("missing.ts")).isFalse();
    }

    @Test
    @Tag("unit")
    void canonicalNamesAreAbsoluteNormalizedAndUseForwardSlashes() {
        FileSystemCompilerHost host = new FileSystemCompilerHost(root);

        String canonical = host.getCanonicalFileName("lib/../src/./b.ts");

        assertThat(canonical).isEqualTo(root.toAbsolutePath().normalize().resolve("src/b.ts").toString().replace('\\', '/'));
        assertThat(canonical).doesNotContain("\\").doesNotContain("/./").doesNotContain("/../");
        assertThat(host.getCanonicalFileName("classpath:lib/prelude.ts")).isEqualTo("classpath:lib/prelude.ts");
        assertThat(host.getCurrentDirectory()).isEqualTo(root.toAbsolutePath().normalize().toString().replace('\\', '/'));
    }
}
