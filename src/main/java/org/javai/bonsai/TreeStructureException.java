package org.javai.bonsai;

/**
 * Thrown when a tree violates a structural invariant the compiler depends on.
 * <p>This covers:</p>
 * <ul>
 *   <li>non-tree topology (cycles, shared children, several roots)</li>
 *   <li>leaves with outgoing edges</li>
 *   <li>splits without exactly one fallback branch</li>
 *   <li>state that cannot qualify a compound feature</li>
 * </ul>
 */
public class TreeStructureException extends BonsaiException {

	public TreeStructureException(String message, String nodeId) {
		super(message, nodeId);
	}

	public TreeStructureException(String message, String nodeId, Throwable cause) {
		super(message, nodeId, cause);
	}
}
