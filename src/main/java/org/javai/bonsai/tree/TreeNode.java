package org.javai.bonsai.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * A node of a bidding tree. Sealed to ensure all node variants are known.
 * <p>
 * Nodes can be:
 * <ul>
 *   <li>{@link Split} - a decision point testing one feature</li>
 *   <li>{@link Leaf} - a terminal node carrying a bid</li>
 *   <li>{@link DefaultLeaf} - the terminal node reached when no sibling condition matched</li>
 * </ul>
 */
public sealed interface TreeNode {

	String id();

	NodeState state();

	/**
	 * Accepts a visitor and dispatches to the method for this variant.
	 */
	<R> R accept(TreeNodeVisitor<R> visitor);

	/**
	 * A node that ends recursion with a bid.
	 */
	sealed interface Terminal extends TreeNode {

		double output();

		boolean noBid();

		Optional<String> label();

		/**
		 * Whether a {@code leaf_name} line carrying {@link #label()} precedes the value.
		 */
		boolean smart();
	}

	/**
	 * @param id unique node id
	 * @param feature the feature the outgoing edges test
	 * @param state constraints enforced by ancestors
	 */
	record Split(String id, String feature, NodeState state) implements TreeNode {
		public Split {
			Objects.requireNonNull(id, "id");
			Objects.requireNonNull(feature, "feature");
			state = state != null ? state : NodeState.empty();
		}

		@Override
		public <R> R accept(TreeNodeVisitor<R> visitor) {
			return visitor.visitSplit(this);
		}
	}

	/**
	 * @param id unique node id
	 * @param output the bid
	 * @param noBid renders the no-bid token instead of {@code output}
	 * @param label display label, required when {@code smart}
	 * @param smart renders a {@code leaf_name} line ahead of the value
	 * @param state constraints enforced by ancestors
	 */
	record Leaf(String id, double output, boolean noBid, Optional<String> label, boolean smart, NodeState state)
			implements Terminal {
		public Leaf {
			Objects.requireNonNull(id, "id");
			label = label != null ? label : Optional.empty();
			state = state != null ? state : NodeState.empty();
			if (smart && label.isEmpty()) {
				throw new IllegalArgumentException("Smart leaf " + id + " needs a label");
			}
		}

		public static Leaf of(String id, double output, NodeState state) {
			return new Leaf(id, output, false, Optional.empty(), false, state);
		}

		public static Leaf smart(String id, String label, double output, NodeState state) {
			return new Leaf(id, output, false, Optional.of(label), true, state);
		}

		public static Leaf noBid(String id, NodeState state) {
			return new Leaf(id, 0.0, true, Optional.empty(), false, state);
		}

		@Override
		public <R> R accept(TreeNodeVisitor<R> visitor) {
			return visitor.visitLeaf(this);
		}
	}

	/**
	 * Terminal reached through a split's fallback branch. Carries the same attributes as
	 * {@link Leaf}.
	 */
	record DefaultLeaf(String id, double output, boolean noBid, Optional<String> label, boolean smart,
			NodeState state) implements Terminal {
		public DefaultLeaf {
			Objects.requireNonNull(id, "id");
			label = label != null ? label : Optional.empty();
			state = state != null ? state : NodeState.empty();
			if (smart && label.isEmpty()) {
				throw new IllegalArgumentException("Smart default leaf " + id + " needs a label");
			}
		}

		public static DefaultLeaf of(String id, double output, NodeState state) {
			return new DefaultLeaf(id, output, false, Optional.empty(), false, state);
		}

		public static DefaultLeaf smart(String id, String label, double output, NodeState state) {
			return new DefaultLeaf(id, output, false, Optional.of(label), true, state);
		}

		public static DefaultLeaf noBid(String id, NodeState state) {
			return new DefaultLeaf(id, 0.0, true, Optional.empty(), false, state);
		}

		@Override
		public <R> R accept(TreeNodeVisitor<R> visitor) {
			return visitor.visitDefaultLeaf(this);
		}
	}
}
