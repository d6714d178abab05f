package org.javai.bonsai.dialect;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for dialect YAML documents.
 * <pre>
 * dialect_version: 1
 * legacy_last_edge_fallback: false
 * features:
 *   segment:
 *     assignment: bare
 *   age:
 *     qualifier: segment
 * </pre>
 */
public class BonsaiDialectParser {

	private final Yaml yaml = new Yaml();

	public BonsaiDialect parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (DialectParseException e) {
			throw e;
		} catch (Exception e) {
			throw new DialectParseException("Failed to parse dialect from path: " + path, e);
		}
	}

	public BonsaiDialect parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildDialect(data);
		} catch (DialectParseException e) {
			throw e;
		} catch (Exception e) {
			throw new DialectParseException("Failed to parse dialect from input stream", e);
		}
	}

	public BonsaiDialect parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildDialect(data);
		} catch (DialectParseException e) {
			throw e;
		} catch (Exception e) {
			throw new DialectParseException("Failed to parse dialect from reader", e);
		}
	}

	public BonsaiDialect parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildDialect(data);
		} catch (DialectParseException e) {
			throw e;
		} catch (Exception e) {
			throw new DialectParseException("Failed to parse dialect from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private BonsaiDialect buildDialect(Map<String, Object> data) {
		if (data == null) {
			throw new DialectParseException("Dialect document is empty");
		}
		Object versionObj = data.get("dialect_version");
		if (versionObj == null) {
			throw new DialectParseException("Missing required 'dialect_version'");
		}

		Object legacy = data.get("legacy_last_edge_fallback");
		if (legacy != null && !(legacy instanceof Boolean)) {
			throw new DialectParseException("'legacy_last_edge_fallback' must be true or false, got: " + legacy);
		}

		Map<String, Object> featuresMap = (Map<String, Object>) data.get("features");
		return new BonsaiDialect(
			String.valueOf(versionObj),
			buildFeatures(featuresMap),
			Boolean.TRUE.equals(legacy)
		);
	}

	@SuppressWarnings("unchecked")
	private Map<String, FeatureDefinition> buildFeatures(Map<String, Object> featuresMap) {
		if (featuresMap == null) {
			return Map.of();
		}

		Map<String, FeatureDefinition> features = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : featuresMap.entrySet()) {
			Object value = entry.getValue();
			if (value != null && !(value instanceof Map)) {
				throw new DialectParseException("Feature '" + entry.getKey() + "' must be a mapping");
			}
			Map<String, Object> featureData = value != null ? (Map<String, Object>) value : Map.of();
			features.put(entry.getKey(), buildFeature(entry.getKey(), featureData));
		}
		return features;
	}

	private FeatureDefinition buildFeature(String name, Map<String, Object> featureData) {
		Object styleObj = featureData.get("assignment");
		AssignmentStyle style;
		try {
			style = styleObj != null ? AssignmentStyle.valueOf(styleObj.toString()) : AssignmentStyle.equals;
		} catch (IllegalArgumentException e) {
			throw new DialectParseException("Feature '" + name + "' has unknown assignment style: " + styleObj, e);
		}

		Object qualifier = featureData.get("qualifier");
		if (name.equals(qualifier)) {
			throw new DialectParseException("Feature '" + name + "' cannot qualify itself");
		}
		return new FeatureDefinition(style, Optional.ofNullable(qualifier).map(Object::toString));
	}
}
