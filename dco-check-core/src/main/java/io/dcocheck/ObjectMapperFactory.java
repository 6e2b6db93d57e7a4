package io.dcocheck;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for creating consistently configured {@link ObjectMapper} instances.
 *
 * <p>
 * The JSON mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that Java camelCase
 * record fields map to the snake_case keys used by GitHub payloads
 * (e.g.&nbsp;{@code headSha} &harr; {@code head_sha}). Unknown properties are ignored and
 * unknown enum values fall back to the constant annotated with
 * {@code @JsonEnumDefaultValue}.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new JSON {@link ObjectMapper} for GitHub payloads.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		configure(mapper);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

	/**
	 * Create a new YAML {@link ObjectMapper} for configuration files. Property names are
	 * used as declared.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper createYaml() {
		ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
		configure(mapper);
		return mapper;
	}

	private static void configure(ObjectMapper mapper) {
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
	}

}
