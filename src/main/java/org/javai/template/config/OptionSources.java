package org.javai.template.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Reads option strings from configuration so they can be passed to
 * {@link org.javai.template.OptionResolver} or {@link org.javai.template.Template#option(String...)}.
 *
 * <p>Supported sources:
 * <ul>
 *   <li>{@code template.options} system property, falling back to the
 *       {@code TEMPLATE_OPTIONS} environment variable, as a comma-separated list</li>
 *   <li>a JSON array of option strings, e.g. {@code ["missingkey=zero", "onpanic=nop"]}</li>
 *   <li>a JSON object of key to value, e.g. {@code {"missingkey": "zero"}}</li>
 * </ul>
 *
 * <p>Nothing here checks that an option is valid. That is left to the resolver so a
 * bad option fails the same way wherever it came from.
 */
public final class OptionSources {

	public static final String SYSTEM_PROPERTY = "template.options";
	public static final String ENVIRONMENT_VARIABLE = "TEMPLATE_OPTIONS";

	private static final Logger logger = LoggerFactory.getLogger(OptionSources.class);
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private OptionSources() {
	}

	/**
	 * Reads options from the system property, then the environment variable.
	 *
	 * @return the configured options, or an empty list if neither is set
	 */
	public static List<String> fromEnvironment() {
		return fromEnvironment(System::getProperty, System::getenv);
	}

	static List<String> fromEnvironment(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
		String value = systemProperties.apply(SYSTEM_PROPERTY);
		String source = SYSTEM_PROPERTY;
		if (value == null || value.isBlank()) {
			value = environment.apply(ENVIRONMENT_VARIABLE);
			source = ENVIRONMENT_VARIABLE;
		}
		if (value == null || value.isBlank()) {
			logger.debug("No template options configured via {} or {}", SYSTEM_PROPERTY, ENVIRONMENT_VARIABLE);
			return List.of();
		}
		List<String> options = split(value);
		logger.debug("Read {} template option(s) from {}", options.size(), source);
		return options;
	}

	/**
	 * Splits a comma-separated list, trimming entries and dropping blank ones.
	 */
	public static List<String> split(String commaSeparated) {
		Objects.requireNonNull(commaSeparated, "commaSeparated must not be null");
		List<String> options = new ArrayList<>();
		for (String part : commaSeparated.split(",")) {
			String trimmed = part.strip();
			if (!trimmed.isEmpty()) {
				options.add(trimmed);
			}
		}
		return List.copyOf(options);
	}

	/**
	 * Reads options from a JSON array of strings or a JSON object of key to value.
	 * Object entries become {@code key=value} strings in document order.
	 *
	 * @throws IllegalArgumentException if the document is not valid JSON or has another shape
	 */
	public static List<String> fromJson(String json) {
		Objects.requireNonNull(json, "json must not be null");
		JsonNode root;
		try {
			root = MAPPER.readTree(json);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Template options are not valid JSON: " + e.getOriginalMessage(), e);
		}

		List<String> options;
		if (root != null && root.isArray()) {
			options = fromArray(root);
		} else if (root != null && root.isObject()) {
			options = fromObject(root);
		} else {
			throw new IllegalArgumentException(
				"Template options must be a JSON array of strings or a JSON object of strings");
		}
		logger.debug("Read {} template option(s) from JSON", options.size());
		return options;
	}

	private static List<String> fromArray(JsonNode array) {
		List<String> options = new ArrayList<>();
		for (JsonNode element : array) {
			options.add(textOf(element, "array element"));
		}
		return List.copyOf(options);
	}

	private static List<String> fromObject(JsonNode object) {
		List<String> options = new ArrayList<>();
		Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			options.add(field.getKey() + "=" + textOf(field.getValue(), "value of '" + field.getKey() + "'"));
		}
		return List.copyOf(options);
	}

	private static String textOf(JsonNode node, String what) {
		if (!node.isTextual()) {
			throw new IllegalArgumentException("Template option " + what + " must be a string, got " + node.getNodeType());
		}
		return node.asText();
	}
}
