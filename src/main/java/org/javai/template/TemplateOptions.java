package org.javai.template;

import java.util.List;
import java.util.Objects;

/**
 * The runtime policies attached to one {@link Template}.
 *
 * <p>Both policies always hold a value; a new instance starts at
 * {@link MissingKeyPolicy#INVALID} and {@link OnFaultPolicy#RECOVER}. The only write
 * path is {@link OptionResolver}, which changes one field per accepted option.
 *
 * <p>Instances are not synchronised. Finish applying options before handing the
 * owning template to concurrent renderers.
 */
public final class TemplateOptions {

    private MissingKeyPolicy missingKey = MissingKeyPolicy.INVALID;
    private OnFaultPolicy onFault = OnFaultPolicy.RECOVER;

    /**
     * Creates options holding the default policies.
     */
    public TemplateOptions() {
    }

    private TemplateOptions(MissingKeyPolicy missingKey, OnFaultPolicy onFault) {
        this.missingKey = missingKey;
        this.onFault = onFault;
    }

    /**
     * The policy the engine applies when a map lookup misses.
     */
    public MissingKeyPolicy currentMissingKeyPolicy() {
        return missingKey;
    }

    /**
     * The policy the engine applies when a template function throws.
     */
    public OnFaultPolicy currentFaultPolicy() {
        return onFault;
    }

    /**
     * Returns independent options holding the same policies.
     */
    public TemplateOptions copy() {
        return new TemplateOptions(missingKey, onFault);
    }

    /**
     * Renders the current policies as canonical option strings.
     * Resolving them against fresh options reproduces this state.
     */
    public List<String> toOptionStrings() {
        return List.of(
                OptionKey.MISSING_KEY.key() + "=" + missingKey.optionValue(),
                OptionKey.ON_PANIC.key() + "=" + onFault.optionValue());
    }

    void missingKey(MissingKeyPolicy missingKey) {
        this.missingKey = Objects.requireNonNull(missingKey, "missingKey must not be null");
    }

    void onFault(OnFaultPolicy onFault) {
        this.onFault = Objects.requireNonNull(onFault, "onFault must not be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TemplateOptions other)) {
            return false;
        }
        return missingKey == other.missingKey && onFault == other.onFault;
    }

    @Override
    public int hashCode() {
        return Objects.hash(missingKey, onFault);
    }

    @Override
    public String toString() {
        return "TemplateOptions[missingKey=" + missingKey + ", onFault=" + onFault + "]";
    }
}
