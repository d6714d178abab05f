package org.javai.bonsai.render;

import java.util.List;
import org.javai.bonsai.tree.TreeEdge;

/**
 * A split's edges in emission order.
 *
 * @param conditional edges written as {@code if} then {@code elif}, in insertion order
 * @param fallback edge written last as {@code else}
 */
public record OrderedBranches(List<TreeEdge> conditional, TreeEdge fallback) {

	public OrderedBranches {
		conditional = List.copyOf(conditional);
	}
}
