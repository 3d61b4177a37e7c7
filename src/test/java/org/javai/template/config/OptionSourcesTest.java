package org.javai.template.config;

import org.javai.template.MissingKeyPolicy;
import org.javai.template.OnFaultPolicy;
import org.javai.template.Template;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class OptionSourcesTest {

	@AfterEach
	void clearProperty() {
		System.clearProperty(OptionSources.SYSTEM_PROPERTY);
	}

	@Test
	void fromEnvironment_readsSystemProperty() {
		System.setProperty(OptionSources.SYSTEM_PROPERTY, "missingkey=zero, onpanic=nop");

		List<String> options = OptionSources.fromEnvironment();

		assertThat(options).containsExactly("missingkey=zero", "onpanic=nop");
	}

	@Test
	void fromEnvironment_fallsBackToEnvironmentVariable() {
		Map<String, String> env = Map.of(OptionSources.ENVIRONMENT_VARIABLE, "missingkey=error");

		List<String> options = OptionSources.fromEnvironment(name -> "  ", env::get);

		assertThat(options).containsExactly("missingkey=error");
	}

	@Test
	void fromEnvironment_systemPropertyWins() {
		Map<String, String> props = Map.of(OptionSources.SYSTEM_PROPERTY, "onpanic=nop");
		Map<String, String> env = Map.of(OptionSources.ENVIRONMENT_VARIABLE, "missingkey=error");

		assertThat(OptionSources.fromEnvironment(props::get, env::get)).containsExactly("onpanic=nop");
	}

	@Test
	void fromEnvironment_nothingConfigured_isEmpty() {
		assertThat(OptionSources.fromEnvironment(name -> null, name -> null)).isEmpty();
	}

	@Test
	void split_trimsAndDropsBlanks() {
		assertThat(OptionSources.split(" missingkey=zero ,, onpanic=nop,"))
				.containsExactly("missingkey=zero", "onpanic=nop");
	}

	@Test
	void fromJson_array() {
		List<String> options = OptionSources.fromJson("""
				["missingkey=error", "onpanic=nop"]
				""");

		assertThat(options).containsExactly("missingkey=error", "onpanic=nop");
	}

	@Test
	void fromJson_object_keepsDocumentOrder() {
		List<String> options = OptionSources.fromJson("""
				{"onpanic": "nop", "missingkey": "zero"}
				""");

		assertThat(options).containsExactly("onpanic=nop", "missingkey=zero");
	}

	@Test
	void fromJson_doesNotValidateOptions() {
		assertThat(OptionSources.fromJson("[\"bogus\"]")).containsExactly("bogus");
	}

	@Test
	void fromJson_malformed_throws() {
		assertThatThrownBy(() -> OptionSources.fromJson("not json"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("not valid JSON")
				.hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
	}

	@Test
	void fromJson_wrongShape_throws() {
		assertThatThrownBy(() -> OptionSources.fromJson("\"missingkey=zero\""))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> OptionSources.fromJson("[1]"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must be a string");
		assertThatThrownBy(() -> OptionSources.fromJson("{\"missingkey\": true}"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("missingkey");
	}

	@Test
	void fromJson_feedsTemplate() {
		Template template = Template.named("report")
				.option(OptionSources.fromJson("{\"missingkey\": \"error\", \"onpanic\": \"nop\"}").toArray(String[]::new));

		assertThat(template.options().currentMissingKeyPolicy()).isEqualTo(MissingKeyPolicy.ERROR);
		assertThat(template.options().currentFaultPolicy()).isEqualTo(OnFaultPolicy.NO_RECOVER);
	}
}
