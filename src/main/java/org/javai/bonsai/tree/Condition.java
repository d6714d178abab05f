package org.javai.bonsai.tree;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The test an edge applies to its source split's feature. Sealed so that the
 * renderer knows every kind it has to express.
 * <p>
 * Conditions also describe what ancestors already enforced, see {@link NodeState}.
 */
public sealed interface Condition {

	/**
	 * Short name used in error messages and in tree documents.
	 */
	String kind();

	static Assignment assignment(String value) {
		return new Assignment(value);
	}

	static Assignment assignment(long value) {
		return new Assignment(Long.toString(value));
	}

	static Range atMost(BigDecimal upper) {
		return new Range(Optional.empty(), Optional.of(upper));
	}

	static Range atMost(long upper) {
		return atMost(BigDecimal.valueOf(upper));
	}

	static Range above(BigDecimal lower) {
		return new Range(Optional.of(lower), Optional.empty());
	}

	static Range above(long lower) {
		return above(BigDecimal.valueOf(lower));
	}

	static Membership membership(String... values) {
		return new Membership(List.of(values));
	}

	static Unconditional unconditional() {
		return Unconditional.INSTANCE;
	}

	/**
	 * The feature equals {@code value}. Numeric values are kept as their text.
	 */
	record Assignment(String value) implements Condition {
		public Assignment {
			Objects.requireNonNull(value, "value");
		}

		@Override
		public String kind() {
			return "assignment";
		}
	}

	/**
	 * The feature falls within an interval; each side is open when its bound is empty.
	 */
	record Range(Optional<BigDecimal> lower, Optional<BigDecimal> upper) implements Condition {
		public Range {
			Objects.requireNonNull(lower, "lower");
			Objects.requireNonNull(upper, "upper");
			if (lower.isEmpty() && upper.isEmpty()) {
				throw new IllegalArgumentException("A range needs at least one finite bound");
			}
		}

		@Override
		public String kind() {
			return "range";
		}
	}

	/**
	 * The feature takes one of {@code values}. Order is significant for rendering.
	 */
	record Membership(List<String> values) implements Condition {
		public Membership {
			values = List.copyOf(values);
			if (values.isEmpty()) {
				throw new IllegalArgumentException("A membership test needs at least one value");
			}
		}

		@Override
		public String kind() {
			return "membership";
		}
	}

	/**
	 * No test: the branch taken when nothing else matched.
	 */
	final class Unconditional implements Condition {

		private static final Unconditional INSTANCE = new Unconditional();

		private Unconditional() {
		}

		@Override
		public String kind() {
			return "unconditional";
		}

		@Override
		public String toString() {
			return "Unconditional";
		}
	}
}
