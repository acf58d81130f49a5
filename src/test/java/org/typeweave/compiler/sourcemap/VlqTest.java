package org.typeweave.compiler.sourcemap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class VlqTest {

    @Test
    @Tag("unit")
    void encodesKnownValues() {
        assertThat(Vlq.encode(0)).isEqualTo("A");
        assertThat(Vlq.encode(1)).isEqualTo("C");
        assertThat(Vlq.encode(-1)).isEqualTo("D");
        assertThat(Vlq.encode(16)).isEqualTo("gB");
    }

    @Test
    @Tag("unit")
    void decodesAllValuesOfASegment() {
        assertThat(Vlq.decode("AAgBD")).containsExactly(0, 0, 16, -1);
    }

    @Test
    @Tag("unit")
    void rejectsInvalidCharacters() {
        assertThatThrownBy(() -> Vlq.decode("A*")).isInstanceOf(IllegalArgumentException.class);
    }
}
