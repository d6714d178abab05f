package org.javai.bonsai.dialect;

import java.util.Objects;
import java.util.Optional;

/**
 * Declared typing of one feature.
 *
 * @param assignment how assignment tests on the feature are written
 * @param qualifier feature whose assigned value qualifies this one, e.g. {@code segment}
 *                  turns {@code age} into {@code segment[12345].age}
 */
public record FeatureDefinition(AssignmentStyle assignment, Optional<String> qualifier) {

	private static final FeatureDefinition PLAIN = new FeatureDefinition(AssignmentStyle.equals, Optional.empty());

	public FeatureDefinition {
		Objects.requireNonNull(assignment, "assignment");
		qualifier = qualifier != null ? qualifier : Optional.empty();
	}

	/**
	 * Typing of features the dialect does not mention.
	 */
	public static FeatureDefinition plain() {
		return PLAIN;
	}
}
