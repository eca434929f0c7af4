package com.github.dimitryivaniuta.scheduling.frequency;

/**
 * Thrown when a text or a duration cannot be turned into a {@link Frequency}.
 */
public class InvalidFrequencyException extends IllegalArgumentException {

    public static final String MESSAGE = "invalid duration";

    private final String input;

    public InvalidFrequencyException(String input) {
        super(MESSAGE + ": '" + input + "'");
        this.input = input;
    }

    public InvalidFrequencyException(String input, Throwable cause) {
        super(MESSAGE + ": '" + input + "'", cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
