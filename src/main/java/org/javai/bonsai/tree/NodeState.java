package org.javai.bonsai.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Constraints enforced by a node's ancestors, keyed by feature name.
 * Never printed; the renderer reads it to qualify compound features.
 */
public record NodeState(Map<String, Condition> constraints) {

	private static final NodeState EMPTY = new NodeState(Map.of());

	public NodeState {
		constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
	}

	public static NodeState empty() {
		return EMPTY;
	}

	public static NodeState of(String feature, Condition constraint) {
		return EMPTY.with(feature, constraint);
	}

	/**
	 * Returns a copy of this state with one more constraint.
	 */
	public NodeState with(String feature, Condition constraint) {
		Map<String, Condition> copy = new LinkedHashMap<>(constraints);
		copy.put(feature, constraint);
		return new NodeState(copy);
	}

	public Optional<Condition> constraint(String feature) {
		return Optional.ofNullable(constraints.get(feature));
	}
}
