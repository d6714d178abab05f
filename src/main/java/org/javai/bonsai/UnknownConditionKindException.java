package org.javai.bonsai;

/**
 * Thrown when an edge carries a condition kind the renderer cannot express.
 */
public class UnknownConditionKindException extends BonsaiException {

	private final String conditionKind;

	public UnknownConditionKindException(String conditionKind, String nodeId) {
		super("Unknown condition kind '" + conditionKind + "' on edge from node " + nodeId, nodeId);
		this.conditionKind = conditionKind;
	}

	public String conditionKind() {
		return conditionKind;
	}
}
