package io.chatflow.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("test");

        assertThat(result).startsWith("\033[1m");
        assertThat(result).contains("test");
        assertThat(result).endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("test")).isEqualTo("test");
        assertThat(styles.checkmark()).isEqualTo("✓");
        assertThat(styles.rule(3)).isEqualTo("───");
        assertThat(styles.isColorEnabled()).isFalse();
    }

    @Test
    void shouldPickColorByOutcome() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.successOrError("OK", true)).startsWith("\033[0;32m");
        assertThat(styles.successOrError("FAILED", false)).startsWith("\033[38;5;167m");
    }
}
