package com.aclforge.compiler.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextWrapperTest {

    @Test
    @DisplayName("Lines break at word boundaries within the width")
    void shouldWrapAtWords() {
        assertThat(TextWrapper.wrap("alpha beta gamma", 10)).containsExactly("alpha beta", "gamma");
    }

    @Test
    @DisplayName("Words longer than the width are split")
    void shouldSplitLongWords() {
        assertThat(TextWrapper.wrap("abcdefghijkl", 5)).containsExactly("abcde", "fghij", "kl");
    }

    @Test
    @DisplayName("Each input line is wrapped separately and blank lines are dropped")
    void shouldWrapEachLine() {
        assertThat(TextWrapper.wrap(List.of("first line", "  ", "second"), 40))
                .containsExactly("first line", "second");
    }

    @Test
    @DisplayName("Width must be positive")
    void shouldRejectZeroWidth() {
        assertThatThrownBy(() -> TextWrapper.wrap("text", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
