package org.javai.template;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies option strings of the form {@code key=value} to {@link TemplateOptions}.
 *
 * <p>Known options:
 * <ul>
 *   <li>{@code missingkey=default} or {@code missingkey=invalid}: a missing map key
 *       yields a marker printed as {@value MissingKeyPolicy#NO_VALUE_TEXT} (the default)</li>
 *   <li>{@code missingkey=zero}: a missing map key yields the element type's zero value</li>
 *   <li>{@code missingkey=error}: a missing map key stops execution with an error</li>
 *   <li>{@code onpanic=recover}: a fault in a template function becomes an error (the default)</li>
 *   <li>{@code onpanic=nop}: a fault in a template function reaches the caller untouched</li>
 * </ul>
 *
 * <p>Strings are resolved left to right and a later string for the same key overwrites
 * an earlier one. The first string that cannot be resolved stops the run. Strings before
 * it stay applied, the failing string changes nothing, and strings after it are skipped.
 */
public final class OptionResolver {

    private static final Logger LOGGER = LogManager.getLogger(OptionResolver.class);

    private OptionResolver() {
    }

    /**
     * Applies {@code options} in order.
     *
     * @throws InvalidOptionException at the first string that cannot be resolved
     */
    public static TemplateOptions apply(TemplateOptions target, String... options) {
        return tryApply(target, options).getOrThrow();
    }

    /**
     * Applies {@code options} in iteration order.
     *
     * @throws InvalidOptionException at the first string that cannot be resolved
     */
    public static TemplateOptions apply(TemplateOptions target, Iterable<String> options) {
        return tryApply(target, options).getOrThrow();
    }

    /**
     * Applies {@code options} in order and reports a rejection as a value instead of throwing.
     */
    public static OptionOutcome tryApply(TemplateOptions target, String... options) {
        Objects.requireNonNull(options, "options must not be null");
        return tryApply(target, Arrays.asList(options));
    }

    /**
     * Applies {@code options} in iteration order and reports a rejection as a value
     * instead of throwing.
     */
    public static OptionOutcome tryApply(TemplateOptions target, Iterable<String> options) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(options, "options must not be null");

        int applied = 0;
        for (String option : options) {
            Objects.requireNonNull(option, "option must not be null");
            Optional<InvalidOptionException> rejection = applyOne(target, option);
            if (rejection.isPresent()) {
                return new OptionOutcome.Rejected(rejection.get(), applied);
            }
            applied++;
        }
        return new OptionOutcome.Applied(target, applied);
    }

    private static Optional<InvalidOptionException> applyOne(TemplateOptions target, String option) {
        if (option.isEmpty()) {
            return reject(option, InvalidOptionReason.EMPTY);
        }
        int separator = option.indexOf('=');
        if (separator < 0) {
            return reject(option, InvalidOptionReason.MISSING_SEPARATOR);
        }
        String key = option.substring(0, separator);
        String value = option.substring(separator + 1);

        Optional<OptionKey> optionKey = OptionKey.lookup(key);
        if (optionKey.isEmpty()) {
            return reject(option, InvalidOptionReason.UNKNOWN_KEY);
        }
        if (!optionKey.get().assign(target, value)) {
            return reject(option, InvalidOptionReason.UNKNOWN_VALUE);
        }

        LOGGER.atDebug().log("Applied template option [{}] -> {}", option, target);
        return Optional.empty();
    }

    private static Optional<InvalidOptionException> reject(String option, InvalidOptionReason reason) {
        return Optional.of(new InvalidOptionException(option, reason));
    }
}
