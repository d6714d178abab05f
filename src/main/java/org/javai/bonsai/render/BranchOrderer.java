package org.javai.bonsai.render;

import java.util.ArrayList;
import java.util.List;
import org.javai.bonsai.TreeStructureException;
import org.javai.bonsai.dialect.BonsaiDialect;
import org.javai.bonsai.tree.BonsaiTree;
import org.javai.bonsai.tree.TreeEdge;
import org.javai.bonsai.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides in which order a split's branches are written and which one is the {@code else}.
 * <p>
 * The fallback is the edge leading to a default leaf or the unconditional edge. The other
 * edges keep the producer's insertion order; nothing is sorted by value.
 */
public class BranchOrderer {

	private static final Logger logger = LoggerFactory.getLogger(BranchOrderer.class);

	private final BonsaiDialect dialect;

	public BranchOrderer(BonsaiDialect dialect) {
		this.dialect = dialect;
	}

	public OrderedBranches order(BonsaiTree tree, TreeNode.Split split) {
		List<TreeEdge> edges = tree.outgoingEdges(split.id());

		int fallbackIndex = -1;
		for (int i = 0; i < edges.size(); i++) {
			if (!isFallback(tree, edges.get(i))) {
				continue;
			}
			if (fallbackIndex >= 0) {
				throw new TreeStructureException("Split " + split.id() + " has more than one fallback branch ("
						+ edges.get(fallbackIndex).target() + ", " + edges.get(i).target() + ")", split.id());
			}
			fallbackIndex = i;
		}

		if (fallbackIndex < 0 && !dialect.legacyLastEdgeFallback()) {
			throw new TreeStructureException("Split " + split.id() + " has no fallback branch", split.id());
		}
		if (edges.size() < 2) {
			throw new TreeStructureException(
					"Split " + split.id() + " has a single branch and no conditional branch before its else", split.id());
		}

		if (fallbackIndex < 0) {
			fallbackIndex = edges.size() - 1;
			logger.warn("Split {} has no fallback branch; rendering its last edge {} as else",
					split.id(), edges.get(fallbackIndex).describe());
		}

		List<TreeEdge> conditional = new ArrayList<>(edges.size() - 1);
		for (int i = 0; i < edges.size(); i++) {
			if (i != fallbackIndex) {
				conditional.add(edges.get(i));
			}
		}
		return new OrderedBranches(conditional, edges.get(fallbackIndex));
	}

	private static boolean isFallback(BonsaiTree tree, TreeEdge edge) {
		return edge.isUnconditional() || tree.node(edge.target()) instanceof TreeNode.DefaultLeaf;
	}
}
