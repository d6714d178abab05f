package org.javai.bonsai.dialect;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feature typing and compatibility switches the renderer consults.
 *
 * @param version dialect document version
 * @param features per-feature typing; unlisted features use {@link FeatureDefinition#plain()}
 * @param legacyLastEdgeFallback treat the last edge of a split as its {@code else} branch when
 *                               the split has no explicit fallback
 */
public record BonsaiDialect(String version, Map<String, FeatureDefinition> features, boolean legacyLastEdgeFallback) {

	public static final String DEFAULT_RESOURCE = "bonsai-dialect.yaml";

	public BonsaiDialect {
		features = Map.copyOf(features);
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath.
	 */
	public static BonsaiDialect defaults() {
		try (InputStream in = BonsaiDialect.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				throw new DialectParseException("Dialect resource not found on classpath: " + DEFAULT_RESOURCE);
			}
			return new BonsaiDialectParser().parse(in);
		} catch (IOException e) {
			throw new DialectParseException("Failed to close dialect resource " + DEFAULT_RESOURCE, e);
		}
	}

	public FeatureDefinition feature(String name) {
		return features.getOrDefault(name, FeatureDefinition.plain());
	}

	public BonsaiDialect withFeature(String name, FeatureDefinition definition) {
		Map<String, FeatureDefinition> copy = new LinkedHashMap<>(features);
		copy.put(name, definition);
		return new BonsaiDialect(version, copy, legacyLastEdgeFallback);
	}

	public BonsaiDialect withLegacyLastEdgeFallback(boolean enabled) {
		return new BonsaiDialect(version, features, enabled);
	}
}
