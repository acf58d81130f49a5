package org.typeweave.compiler.host;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.cache.TransformCache;
import org.typeweave.compiler.diagnostics.Diagnostic;
import org.typeweave.compiler.frontend.preprocessor.PreProcessor;
import org.typeweave.compiler.frontend.preprocessor.PreprocessOptions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests that the virtual host serves preprocessed text, caches it by content hash and
 * delegates ineligible files untouched.
 */
public class VirtualCompilerHostTest {

    private static final String PIPED = "const y = x |> f;";
    private static final String PIPED_OUT = "const y = __binop__(x, \"|>\", f);";

    private ICompilerHost delegate;
    private PreProcessor preProcessor;
    private TransformCache cache;
    private VirtualCompilerHost host;

    @BeforeEach
    void setUp() {
        delegate = mock(ICompilerHost.class);
        when(delegate.getCanonicalFileName(anyString())).thenAnswer(inv -> inv.getArgument(0));
        preProcessor = spy(new PreProcessor());
        cache = new TransformCache(16);
        host = new VirtualCompilerHost(delegate, preProcessor, PreprocessOptions.defaults(), HostOptions.defaults(),
                new SyntaxValidator(), cache);
    }

    @Test
    @Tag("unit")
    void servesPreprocessedTextWithAMapBackToTheFile() {
        // Arrange
        when(delegate.readFile("src/a.ts")).thenReturn(PIPED);

        // Act
        SourceFile file = host.getSourceFile("src/a.ts");

        // Assert
        assertThat(file.text()).isEqualTo(PIPED_OUT);
        assertThat(file.preprocessed()).isTrue();
        assertThat(file.parseDiagnostics()).isEmpty();
        assertThat(file.map()).isNotNull();
        assertThat(file.map().originalOffsetFor(PIPED_OUT.indexOf("__binop__"))).isEqualTo(PIPED.indexOf('x'));
        assertThat(host.readFile("src/a.ts")).isEqualTo(PIPED_OUT);
        assertThat(host.getOriginalContent("src/a.ts")).isEqualTo(PIPED);
        assertThat(host.hasPreprocessed("src/a.ts")).isTrue();
        assertThat(host.getCachedFileNames()).containsExactly("src/a.ts");
    }

    @Test
    @Tag("unit")
    void unchangedContentIsPreprocessedOnlyOnce() {
        // Arrange
        when(delegate.readFile("src/a.ts")).thenReturn(PIPED);

        // Act
        host.getSourceFile("src/a.ts");
        host.getSourceFile("src/a.ts");
        host.readFile("src/a.ts");

        // Assert
        verify(delegate, times(3)).readFile("src/a.ts");
        verify(preProcessor, times(1)).preprocess(anyString(), any(PreprocessOptions.class));
    }

    @Test
    @Tag("unit")
    void changedContentIsPreprocessedAgain() {
        when(delegate.readFile("src/a.ts")).thenReturn(PIPED, "const y = 1;");

        host.getSourceFile("src/a.ts");
        SourceFile second = host.getSourceFile("src/a.ts");

        assertThat(second.text()).isEqualTo("const y = 1;");
        assertThat(second.preprocessed()).isFalse();
        assertThat(host.hasPreprocessed("src/a.ts")).isFalse();
        verify(preProcessor, times(2)).preprocess(anyString(), any(PreprocessOptions.class));
    }

    @Test
    @Tag("unit")
    void ineligibleFilesComeFromTheDelegateUntouched() {
        // Arrange
        SourceFile declaration = SourceFile.plain("types/lib.d.ts", "declare const x: number;");
        SourceFile vendored = SourceFile.plain("node_modules/dep/index.ts", "export const z = a |> b;");
        when(delegate.getSourceFile("types/lib.d.ts")).thenReturn(declaration);
        when(delegate.getSourceFile("node_modules/dep/index.ts")).thenReturn(vendored);

        // Act & Assert
        assertThat(host.getSourceFile("types/lib.d.ts")).isSameAs(declaration);
        assertThat(host.getSourceFile("node_modules/dep/index.ts")).isSameAs(vendored);
        assertThat(host.getPreprocessedFile("types/lib.d.ts")).isNull();
        assertThat(host.shouldPreprocess("notes.md")).isFalse();
        verify(preProcessor, never()).preprocess(anyString(), any(PreprocessOptions.class));
    }

    @Test
    @Tag("unit")
    void virtualFilesTakePrecedenceOverTheDelegate() {
        // Arrange
        when(delegate.readFile("src/a.ts")).thenReturn("const onDisk = 1;");
        when(delegate.fileExists("src/a.ts")).thenReturn(true);

        // Act
        host.addVirtualFile("src/a.ts", PIPED);
        host.addVirtualFile("src/b.ts", "export const b = 2;");

        // Assert
        assertThat(host.getSourceFile("src/a.ts").text()).isEqualTo(PIPED_OUT);
        assertThat(host.fileExists("src/b.ts")).isTrue();
        assertThat(host.isVirtualFile("src/b.ts")).isTrue();
        assertThat(host.getVirtualFileNames()).containsExactlyInAnyOrder("src/a.ts", "src/b.ts");
        verify(delegate, never()).readFile("src/a.ts");

        assertThat(host.removeVirtualFile("src/a.ts")).isTrue();
        assertThat(host.readOriginal("src/a.ts")).isEqualTo("const onDisk = 1;");
        assertThatThrownBy(() -> host.addVirtualFile("src/c.ts", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void syntaxErrorsOfServedTextBecomeParseDiagnostics() {
        // Arrange
        host.addVirtualFile("src/bad.ts", "const a = f(1;");

        // Act
        SourceFile file = host.getSourceFile("src/bad.ts");

        // Assert
        assertThat(file.hasParseErrors()).isTrue();
        assertThat(file.parseDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Missing ')' for bracket opened at 11");
        assertThat(host.getParseDiagnostics("src/bad.ts")).isEqualTo(file.parseDiagnostics());
    }

    @Test
    @Tag("unit")
    void invalidateDropsTheCachedPreprocessing() {
        // Arrange
        host.addVirtualFile("src/a.ts", PIPED);
        host.getSourceFile("src/a.ts");

        // Act
        host.invalidate("src/a.ts");

        // Assert
        assertThat(host.hasPreprocessed("src/a.ts")).isFalse();
        assertThat(host.getSourceMap("src/a.ts")).isNull();
        assertThat(host.getParseDiagnostics("src/a.ts")).isEmpty();
        assertThat(host.getCachedFileNames()).isEmpty();

        host.getSourceFile("src/a.ts");
        verify(preProcessor, times(2)).preprocess(anyString(), any(PreprocessOptions.class));
    }
}
