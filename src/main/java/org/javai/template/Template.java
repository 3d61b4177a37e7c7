package org.javai.template;

import java.util.Objects;

/**
 * A named template and the runtime policies the rendering engine consults while
 * executing it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Template template = Template.named("report")
 *         .option("missingkey=error", "onpanic=nop");
 *
 * MissingKeyPolicy policy = template.options().currentMissingKeyPolicy();
 * }</pre>
 */
public final class Template {

    private final String name;
    private final TemplateOptions options;

    private Template(String name, TemplateOptions options) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Creates a template with the default policies.
     */
    public static Template named(String name) {
        return new Template(name, new TemplateOptions());
    }

    public String name() {
        return name;
    }

    /**
     * The policies currently attached to this template.
     */
    public TemplateOptions options() {
        return options;
    }

    /**
     * Applies option strings to this template, see {@link OptionResolver}.
     *
     * @return this template
     * @throws InvalidOptionException at the first string that cannot be resolved;
     *         strings before it remain applied
     */
    public Template option(String... options) {
        OptionResolver.apply(this.options, options);
        return this;
    }

    /**
     * Creates a template with a new name and a copy of this template's policies.
     * Options set on either template afterwards do not affect the other.
     */
    public Template copy(String newName) {
        return new Template(newName, options.copy());
    }

    @Override
    public String toString() {
        return "Template[" + name + ", " + options + "]";
    }
}
