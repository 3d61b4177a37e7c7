package org.javai.template;

/**
 * Decides what the rendering engine does when a mapping value is indexed
 * with a key it does not contain.
 */
public enum MissingKeyPolicy {
    /**
     * The lookup yields a "no value" marker and rendering continues.
     * When printed, the marker renders as {@link #NO_VALUE_TEXT}.
     */
    INVALID("invalid"),

    /**
     * The lookup yields the zero value of the mapping's declared value type.
     */
    ZERO_VALUE("zero"),

    /**
     * The lookup aborts the current render with an error.
     */
    ERROR("error");

    /**
     * Text printed for the marker produced under {@link #INVALID}.
     */
    public static final String NO_VALUE_TEXT = "<no value>";

    private final String optionValue;

    MissingKeyPolicy(String optionValue) {
        this.optionValue = optionValue;
    }

    /**
     * The canonical value used for this policy in a {@code missingkey=} option.
     */
    public String optionValue() {
        return optionValue;
    }
}
