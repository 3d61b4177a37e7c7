package org.javai.template;

import java.util.Objects;

/**
 * Thrown when an option string cannot be resolved.
 * This is an unchecked exception because a bad option is a misconfiguration at the
 * call site, not a condition the caller is expected to recover from.
 */
public class InvalidOptionException extends RuntimeException {

    private final String option;
    private final InvalidOptionReason reason;

    public InvalidOptionException(String option, InvalidOptionReason reason) {
        super(messageFor(option, reason));
        this.option = Objects.requireNonNull(option, "option must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * The rejected option string, exactly as it was supplied.
     */
    public String option() {
        return option;
    }

    public InvalidOptionReason reason() {
        return reason;
    }

    private static String messageFor(String option, InvalidOptionReason reason) {
        return reason == InvalidOptionReason.EMPTY
                ? "empty option string"
                : "unrecognized option: " + option;
    }
}
