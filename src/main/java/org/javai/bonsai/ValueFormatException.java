package org.javai.bonsai;

/**
 * Thrown when a leaf output or an edge value has no literal form in the bidding language.
 */
public class ValueFormatException extends BonsaiException {

	public ValueFormatException(String message, String nodeId) {
		super(message, nodeId);
	}
}
