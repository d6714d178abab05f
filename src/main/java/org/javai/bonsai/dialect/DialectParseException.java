package org.javai.bonsai.dialect;

import org.javai.bonsai.BonsaiException;

/**
 * Exception thrown when a dialect document cannot be read or is malformed. It concerns
 * the document as a whole, so {@link #nodeId()} is always {@code null}.
 */
public class DialectParseException extends BonsaiException {

	public DialectParseException(String message) {
		super(message, null);
	}

	public DialectParseException(String message, Throwable cause) {
		super(message, null, cause);
	}
}
