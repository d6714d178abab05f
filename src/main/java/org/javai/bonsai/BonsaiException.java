package org.javai.bonsai;

/**
 * Base class for every failure raised while building or rendering a bidding tree.
 * <p>
 * Rendering is a pure function of the tree, so none of these are retried: the
 * caller gets the node id that locates the defect and no partial output.
 */
public abstract class BonsaiException extends RuntimeException {

	private final String nodeId;

	protected BonsaiException(String message, String nodeId) {
		super(message);
		this.nodeId = nodeId;
	}

	protected BonsaiException(String message, String nodeId, Throwable cause) {
		super(message, cause);
		this.nodeId = nodeId;
	}

	/**
	 * Id of the node the failure was detected at, or {@code null} when it concerns
	 * the document as a whole.
	 */
	public String nodeId() {
		return nodeId;
	}
}
