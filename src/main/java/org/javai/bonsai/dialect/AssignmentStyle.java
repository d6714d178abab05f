package org.javai.bonsai.dialect;

/**
 * How an assignment test on a feature is written: {@code segment 12345} or {@code os="ios"}.
 */
public enum AssignmentStyle {
	bare,
	equals
}
