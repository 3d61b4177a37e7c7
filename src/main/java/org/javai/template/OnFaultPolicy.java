package org.javai.template;

/**
 * Decides what the rendering engine does when a user-supplied template function
 * throws while it is being evaluated.
 */
public enum OnFaultPolicy {
    /**
     * The engine catches the fault and turns it into a render error.
     * Rendering of that invocation stops; the host carries on.
     */
    RECOVER("recover"),

    /**
     * The engine leaves the fault alone and it reaches the engine's caller unmodified.
     */
    NO_RECOVER("nop");

    private final String optionValue;

    OnFaultPolicy(String optionValue) {
        this.optionValue = optionValue;
    }

    /**
     * The value used for this policy in an {@code onpanic=} option.
     */
    public String optionValue() {
        return optionValue;
    }
}
