package org.javai.bonsai;

/**
 * Thrown when a node declares a variant other than split, leaf or default leaf.
 */
public class UnknownNodeKindException extends BonsaiException {

	private final String nodeKind;

	public UnknownNodeKindException(String nodeKind, String nodeId) {
		super("Unknown node kind '" + nodeKind + "' for node " + nodeId, nodeId);
		this.nodeKind = nodeKind;
	}

	public String nodeKind() {
		return nodeKind;
	}
}
