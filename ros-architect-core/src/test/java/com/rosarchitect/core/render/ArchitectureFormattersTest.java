package com.rosarchitect.core.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArchitectureFormatters} SPI discovery.
 */
class ArchitectureFormattersTest {

    @Test
    void available_listsBuiltInFormattersById() {
        assertThat(ArchitectureFormatters.available())
            .extracting(ArchitectureFormatter::getId)
            .containsExactly("acme", "json", "mermaid", "text");
    }

    @Test
    void find_ignoresCase() {
        assertThat(ArchitectureFormatters.find("JSON")).containsInstanceOf(JsonArchitectureFormatter.class);
        assertThat(ArchitectureFormatters.find("graphviz")).isEmpty();
    }
}
