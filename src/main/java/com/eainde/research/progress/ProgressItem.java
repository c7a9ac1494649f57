package com.eainde.research.progress;

/**
 * One line of the progress board.
 */
public record ProgressItem(String key, String message, boolean done, boolean hideIndicator) {

    ProgressItem withDone() {
        return new ProgressItem(key, message, true, hideIndicator);
    }

    /**
     * Console form of the line: {@code [✓]} when done, {@code […]} while pending,
     * no indicator when hidden.
     */
    public String render() {
        if (hideIndicator) {
            return message;
        }
        return (done ? "[✓] " : "[…] ") + message;
    }
}
