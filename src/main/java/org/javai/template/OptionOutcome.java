package org.javai.template;

import java.util.Objects;
import java.util.function.Function;

/**
 * The result of resolving a sequence of option strings.
 * Either {@link Applied} when every string was accepted, or {@link Rejected}
 * carrying the first string that was not.
 *
 * <p>In both cases {@link #appliedCount()} says how many leading strings were written
 * to the options before resolution stopped. A rejection does not undo them.
 */
public sealed interface OptionOutcome permits OptionOutcome.Applied, OptionOutcome.Rejected {

    /**
     * Every option string was accepted.
     *
     * @param options the options the strings were applied to
     * @param appliedCount the number of strings applied
     */
    record Applied(TemplateOptions options, int appliedCount) implements OptionOutcome {

        public Applied {
            Objects.requireNonNull(options, "options must not be null");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public TemplateOptions getOrThrow() {
            return options;
        }

        @Override
        public TemplateOptions recover(Function<? super InvalidOptionException, TemplateOptions> recovery) {
            return options;
        }
    }

    /**
     * An option string was rejected; strings after it were not looked at.
     *
     * @param error the rejection, carrying the offending string
     * @param appliedCount the number of strings applied before the rejected one
     */
    record Rejected(InvalidOptionException error, int appliedCount) implements OptionOutcome {

        public Rejected {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public TemplateOptions getOrThrow() {
            throw error;
        }

        @Override
        public TemplateOptions recover(Function<? super InvalidOptionException, TemplateOptions> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(error);
        }
    }

    boolean isOk();

    default boolean isRejected() {
        return !isOk();
    }

    int appliedCount();

    /**
     * Returns the options, or throws the {@link InvalidOptionException} of a rejection.
     */
    TemplateOptions getOrThrow();

    /**
     * Returns the options, or the result of {@code recovery} for a rejection.
     */
    TemplateOptions recover(Function<? super InvalidOptionException, TemplateOptions> recovery);
}
