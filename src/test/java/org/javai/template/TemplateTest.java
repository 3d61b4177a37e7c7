package org.javai.template;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TemplateTest {

    @Test
    void named_startsWithDefaultPolicies() {
        Template template = Template.named("page");

        assertThat(template.name()).isEqualTo("page");
        assertThat(template.options().currentMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.INVALID);
        assertThat(template.options().currentFaultPolicy()).isEqualTo(OnFaultPolicy.RECOVER);
    }

    @Test
    void named_blankName_throws() {
        assertThatThrownBy(() -> Template.named(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Template.named(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void option_chainsAndApplies() {
        Template template = Template.named("page")
                .option("missingkey=error")
                .option("onpanic=nop");

        assertThat(template.options().currentMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.ERROR);
        assertThat(template.options().currentFaultPolicy()).isEqualTo(OnFaultPolicy.NO_RECOVER);
    }

    @Test
    void option_invalid_propagatesAndKeepsEarlierOptions() {
        Template template = Template.named("page");

        assertThatThrownBy(() -> template.option("missingkey=zero", "missingkey=bogus"))
                .isInstanceOf(InvalidOptionException.class)
                .hasMessage("unrecognized option: missingkey=bogus");

        assertThat(template.options().currentMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.ZERO_VALUE);
    }

    @Test
    void copy_carriesPoliciesButNotLaterChanges() {
        Template original = Template.named("page").option("missingkey=error");

        Template copy = original.copy("page-copy").option("onpanic=nop");
        original.option("missingkey=zero");

        assertThat(copy.name()).isEqualTo("page-copy");
        assertThat(copy.options().currentMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.ERROR);
        assertThat(copy.options().currentFaultPolicy()).isEqualTo(OnFaultPolicy.NO_RECOVER);
        assertThat(original.options().currentFaultPolicy()).isEqualTo(OnFaultPolicy.RECOVER);
    }
}
