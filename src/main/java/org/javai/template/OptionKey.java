package org.javai.template;

import java.util.List;
import java.util.Optional;

/**
 * The keys recognised on the left of an option string's {@code =}.
 *
 * <p>This is the only place where option text is mapped to policy values. Everything
 * past the resolver works with {@link MissingKeyPolicy} and {@link OnFaultPolicy}.
 */
public enum OptionKey {

    /**
     * {@code missingkey=invalid|default|zero|error}, see {@link MissingKeyPolicy}.
     */
    MISSING_KEY("missingkey", List.of("invalid", "default", "zero", "error")) {
        @Override
        boolean assign(TemplateOptions options, String value) {
            MissingKeyPolicy policy = switch (value) {
                case "invalid", "default" -> MissingKeyPolicy.INVALID;
                case "zero" -> MissingKeyPolicy.ZERO_VALUE;
                case "error" -> MissingKeyPolicy.ERROR;
                default -> null;
            };
            if (policy == null) {
                return false;
            }
            options.missingKey(policy);
            return true;
        }
    },

    /**
     * {@code onpanic=recover|nop}, see {@link OnFaultPolicy}.
     */
    ON_PANIC("onpanic", List.of("recover", "nop")) {
        @Override
        boolean assign(TemplateOptions options, String value) {
            OnFaultPolicy policy = switch (value) {
                case "recover" -> OnFaultPolicy.RECOVER;
                case "nop" -> OnFaultPolicy.NO_RECOVER;
                default -> null;
            };
            if (policy == null) {
                return false;
            }
            options.onFault(policy);
            return true;
        }
    };

    private final String key;
    private final List<String> knownValues;

    OptionKey(String key, List<String> knownValues) {
        this.key = key;
        this.knownValues = knownValues;
    }

    /**
     * The key as written in an option string.
     */
    public String key() {
        return key;
    }

    /**
     * Every value this key accepts, aliases included.
     */
    public List<String> knownValues() {
        return knownValues;
    }

    /**
     * Finds the key with the given spelling. Matching is exact and case-sensitive.
     */
    public static Optional<OptionKey> lookup(String key) {
        for (OptionKey candidate : values()) {
            if (candidate.key.equals(key)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Writes the policy named by {@code value} into {@code options}.
     * Leaves {@code options} untouched and returns false if the value is not recognised.
     */
    abstract boolean assign(TemplateOptions options, String value);
}
