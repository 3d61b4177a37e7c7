package org.javai.template;

/**
 * Why an option string was rejected.
 */
public enum InvalidOptionReason {
    /** The option string was empty. */
    EMPTY,

    /** The option string has no {@code =}; bare keyword options are not recognised. */
    MISSING_SEPARATOR,

    /** The part before the first {@code =} is not a known option key. */
    UNKNOWN_KEY,

    /** The key is known but the value after it is not one it accepts. */
    UNKNOWN_VALUE
}
