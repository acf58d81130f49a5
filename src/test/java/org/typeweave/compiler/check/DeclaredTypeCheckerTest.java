package org.typeweave.compiler.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.typeweave.compiler.host.SourceFile;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the declaration-based answers to the type queries macros can make.
 */
public class DeclaredTypeCheckerTest {

    private static final String SHAPES = """
            interface Point {
              readonly x: number;
              y?: number;
              label(prefix: string): string;
              tags: Array<string>
            }
            type Config = { name: string, point: Point };
            const origin: Point = { x: 0, y: 0 };
            const config = load();
            const count = 3;
            const title = "t";
            const box = new Box();
            function load(): Config { return null; }
            """;

    private DeclaredTypeChecker checker;

    @BeforeEach
    void setUp() {
        checker = new DeclaredTypeChecker(List.of(
                SourceFile.plain("src/shapes.ts", SHAPES),
                SourceFile.plain("src/other.ts", "const origin = 5;\n")));
    }

    @Test
    @Tag("unit")
    void enumeratesInterfaceMembersInDeclarationOrder() {
        // Act
        List<PropertyInfo> properties = checker.getPropertiesOfType("Point");

        // Assert
        assertThat(properties).containsExactly(
                new PropertyInfo("x", "number", false, false),
                new PropertyInfo("y", "number", true, false),
                new PropertyInfo("label", "string", false, true),
                new PropertyInfo("tags", "Array<string>", false, false));
    }

    @Test
    @Tag("unit")
    void objectTypeAliasesAreIndexedAndTypeArgumentsIgnored() {
        assertThat(checker.getPropertiesOfType("Config")).extracting(PropertyInfo::name).containsExactly("name", "point");
        assertThat(checker.isKnownType("Point<T>")).isTrue();
        assertThat(checker.isKnownType("Missing")).isFalse();
        assertThat(checker.getPropertiesOfType("Missing")).isEmpty();
    }

    @Test
    @Tag("unit")
    void typesLiteralsAndConstructorCalls() {
        assertThat(checker.typeOfExpression("src/shapes.ts", "42")).isEqualTo("number");
        assertThat(checker.typeOfExpression("src/shapes.ts", "'s'")).isEqualTo("string");
        assertThat(checker.typeOfExpression("src/shapes.ts", "`plain`")).isEqualTo("string");
        assertThat(checker.typeOfExpression("src/shapes.ts", "true")).isEqualTo("boolean");
        assertThat(checker.typeOfExpression("src/shapes.ts", "[1, 2]")).isEqualTo("unknown[]");
        assertThat(checker.typeOfExpression("src/shapes.ts", "new Box()")).isEqualTo("Box");
        assertThat(checker.typeOfExpression("src/shapes.ts", "(42)")).isEqualTo("number");
    }

    @Test
    @Tag("unit")
    void typesNamesThroughAnnotationsAndInitializers() {
        assertThat(checker.typeOfExpression("src/shapes.ts", "count")).isEqualTo("number");
        assertThat(checker.typeOfExpression("src/shapes.ts", "title")).isEqualTo("string");
        assertThat(checker.typeOfExpression("src/shapes.ts", "box")).isEqualTo("Box");
        assertThat(checker.typeOfExpression("src/shapes.ts", "load()")).isEqualTo("Config");
    }

    @Test
    @Tag("unit")
    void followsPropertyAccessChains() {
        assertThat(checker.typeOfExpression("src/shapes.ts", "origin.x")).isEqualTo("number");
        assertThat(checker.typeOfExpression("src/shapes.ts", "config.point.y")).isEqualTo("number");
        assertThat(checker.typeOfExpression("src/shapes.ts", "config.missing.y")).isEqualTo(ITypeChecker.UNKNOWN);
    }

    @Test
    @Tag("unit")
    void fileLocalDeclarationsShadowOtherFiles() {
        assertThat(checker.typeOfExpression("src/other.ts", "origin")).isEqualTo("number");
        assertThat(checker.typeOfExpression("src/shapes.ts", "origin")).isEqualTo("Point");
        assertThat(checker.typeOfExpression("src/third.ts", "count")).isEqualTo("number");
    }

    @Test
    @Tag("unit")
    void anythingElseIsUnknown() {
        assertThat(checker.typeOfExpression("src/shapes.ts", "undeclared")).isEqualTo(ITypeChecker.UNKNOWN);
        assertThat(checker.typeOfExpression("src/shapes.ts", "count + 1")).isEqualTo(ITypeChecker.UNKNOWN);
        assertThat(checker.typeOfExpression("src/shapes.ts", "")).isEqualTo(ITypeChecker.UNKNOWN);
    }
}
