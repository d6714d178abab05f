package org.javai.bonsai.tree;

import java.util.Objects;

/**
 * A directed edge from a split to one of its children.
 *
 * @param source id of the split
 * @param target id of the child
 * @param condition the test that selects the child
 * @param negated render the complement of the condition
 * @param joinStatement quantify the test over a multi-valued feature ({@code every})
 */
public record TreeEdge(String source, String target, Condition condition, boolean negated, boolean joinStatement) {

	public TreeEdge {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(target, "target");
		Objects.requireNonNull(condition, "condition");
	}

	public TreeEdge(String source, String target, Condition condition) {
		this(source, target, condition, false, false);
	}

	public boolean isUnconditional() {
		return condition instanceof Condition.Unconditional;
	}

	public String describe() {
		return source + " -> " + target;
	}
}
