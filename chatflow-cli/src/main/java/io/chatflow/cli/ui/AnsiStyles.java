package io.chatflow.cli.ui;

/// ANSI styling for terminal output.
///
/// Every method returns the styled string; printing is left to the caller. With
/// color disabled the text comes back unchanged, which keeps output readable when
/// piped or captured in tests.
///
/// ### Usage
/// {@snippet :
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.checkmark() + " " + styles.bold("Chatflow is valid"));
/// }
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to apply ANSI codes, false for plain text
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Secondary text such as timings and hints.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Green on success, red otherwise.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    /// Box top-left corner: ┌─
    public String boxTop() {
        return style("┌─", DIM);
    }

    /// Box vertical line: │
    public String boxMid() {
        return style("│", DIM);
    }

    /// Box bottom-left corner: └─
    public String boxBottom() {
        return style("└─", DIM);
    }

    /// Horizontal rule of the given width.
    public String rule(int width) {
        return style("─".repeat(width), DIM);
    }
}
