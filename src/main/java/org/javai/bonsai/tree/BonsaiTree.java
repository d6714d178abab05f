package org.javai.bonsai.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.bonsai.TreeStructureException;

/**
 * Immutable bidding tree: an arena of nodes indexed by insertion position plus an
 * adjacency list of outgoing edges per node.
 * <p>
 * Instances are only created through {@link #builder()}, which rejects graphs that are
 * not rooted trees or whose leaves have outgoing edges. Whether every split has a
 * fallback branch is checked when rendering.
 */
public final class BonsaiTree {

	private final List<TreeNode> nodes;
	private final Map<String, Integer> indexById;
	private final List<List<TreeEdge>> outgoing;
	private final List<TreeEdge> parentEdges;
	private final int rootIndex;
	private final int depth;

	private BonsaiTree(List<TreeNode> nodes, Map<String, Integer> indexById, List<List<TreeEdge>> outgoing,
			List<TreeEdge> parentEdges, int rootIndex, int depth) {
		this.nodes = nodes;
		this.indexById = indexById;
		this.outgoing = outgoing;
		this.parentEdges = parentEdges;
		this.rootIndex = rootIndex;
		this.depth = depth;
	}

	public static Builder builder() {
		return new Builder();
	}

	public TreeNode root() {
		return nodes.get(rootIndex);
	}

	public TreeNode node(String id) {
		return nodes.get(indexOf(id));
	}

	/**
	 * All nodes in insertion order.
	 */
	public List<TreeNode> nodes() {
		return nodes;
	}

	/**
	 * Outgoing edges of a node in insertion order; empty for leaves.
	 */
	public List<TreeEdge> outgoingEdges(String id) {
		return outgoing.get(indexOf(id));
	}

	public Optional<TreeEdge> parentEdge(String id) {
		return Optional.ofNullable(parentEdges.get(indexOf(id)));
	}

	public int size() {
		return nodes.size();
	}

	/**
	 * Number of edges on the longest root-to-leaf path.
	 */
	public int depth() {
		return depth;
	}

	private int indexOf(String id) {
		Integer index = indexById.get(id);
		if (index == null) {
			throw new IllegalArgumentException("No node with id " + id);
		}
		return index;
	}

	/**
	 * Collects nodes and edges in the order the producer emits them. That order is the
	 * emission order of sibling branches.
	 */
	public static final class Builder {

		private final List<TreeNode> nodes = new ArrayList<>();
		private final Map<String, Integer> indexById = new HashMap<>();
		private final List<TreeEdge> edges = new ArrayList<>();

		private Builder() {
		}

		public Builder node(TreeNode node) {
			if (indexById.containsKey(node.id())) {
				throw new TreeStructureException("Duplicate node id " + node.id(), node.id());
			}
			indexById.put(node.id(), nodes.size());
			nodes.add(node);
			return this;
		}

		public Builder split(String id, String feature, NodeState state) {
			return node(new TreeNode.Split(id, feature, state));
		}

		public Builder leaf(String id, double output, NodeState state) {
			return node(TreeNode.Leaf.of(id, output, state));
		}

		public Builder defaultLeaf(String id, double output, NodeState state) {
			return node(TreeNode.DefaultLeaf.of(id, output, state));
		}

		public Builder edge(TreeEdge edge) {
			edges.add(edge);
			return this;
		}

		public Builder edge(String source, String target, Condition condition) {
			return edge(new TreeEdge(source, target, condition));
		}

		/**
		 * Adds the unconditional edge leading to a split's fallback child.
		 */
		public Builder fallbackEdge(String source, String target) {
			return edge(new TreeEdge(source, target, Condition.unconditional()));
		}

		public BonsaiTree build() {
			int size = nodes.size();
			if (size == 0) {
				throw new TreeStructureException("A tree needs at least one node", null);
			}

			List<List<TreeEdge>> outgoing = new ArrayList<>(size);
			List<TreeEdge> parentEdges = new ArrayList<>(size);
			for (int i = 0; i < size; i++) {
				outgoing.add(new ArrayList<>());
				parentEdges.add(null);
			}

			for (TreeEdge edge : edges) {
				int source = resolve(edge.source(), edge);
				int target = resolve(edge.target(), edge);
				TreeNode sourceNode = nodes.get(source);
				if (!(sourceNode instanceof TreeNode.Split)) {
					throw new TreeStructureException(
							"Leaf " + edge.source() + " has an outgoing edge to " + edge.target(), edge.source());
				}
				if (source == target) {
					throw new TreeStructureException("Node " + edge.source() + " has an edge to itself", edge.source());
				}
				if (parentEdges.get(target) != null) {
					throw new TreeStructureException("Node " + edge.target() + " has more than one parent ("
							+ parentEdges.get(target).source() + ", " + edge.source() + ")", edge.target());
				}
				if (nodes.get(target) instanceof TreeNode.DefaultLeaf && !edge.isUnconditional()) {
					throw new TreeStructureException("Edge " + edge.describe()
							+ " leads to a default leaf but carries a " + edge.condition().kind() + " condition",
							edge.target());
				}
				parentEdges.set(target, edge);
				outgoing.get(source).add(edge);
			}

			int rootIndex = findRoot(parentEdges);
			int depth = checkReachable(rootIndex, outgoing);

			for (int i = 0; i < size; i++) {
				TreeNode node = nodes.get(i);
				if (node instanceof TreeNode.Split && outgoing.get(i).isEmpty()) {
					throw new TreeStructureException("Split " + node.id() + " has no outgoing edges", node.id());
				}
			}

			List<List<TreeEdge>> frozen = new ArrayList<>(size);
			for (List<TreeEdge> list : outgoing) {
				frozen.add(List.copyOf(list));
			}
			return new BonsaiTree(
					List.copyOf(nodes),
					Map.copyOf(indexById),
					Collections.unmodifiableList(frozen),
					Collections.unmodifiableList(parentEdges),
					rootIndex,
					depth);
		}

		private int resolve(String id, TreeEdge edge) {
			Integer index = indexById.get(id);
			if (index == null) {
				throw new TreeStructureException("Edge " + edge.describe() + " references unknown node " + id, id);
			}
			return index;
		}

		private int findRoot(List<TreeEdge> parentEdges) {
			int root = -1;
			for (int i = 0; i < parentEdges.size(); i++) {
				if (parentEdges.get(i) != null) {
					continue;
				}
				if (root >= 0) {
					throw new TreeStructureException("Tree has more than one root (" + nodes.get(root).id() + ", "
							+ nodes.get(i).id() + ")", nodes.get(i).id());
				}
				root = i;
			}
			if (root < 0) {
				throw new TreeStructureException("Tree has no root; every node has a parent", null);
			}
			if (!(nodes.get(root) instanceof TreeNode.Split)) {
				throw new TreeStructureException("Root " + nodes.get(root).id() + " is not a split", nodes.get(root).id());
			}
			return root;
		}

		// Every node has at most one parent, so reaching all of them from the root rules out cycles.
		private int checkReachable(int rootIndex, List<List<TreeEdge>> outgoing) {
			boolean[] seen = new boolean[nodes.size()];
			Deque<int[]> queue = new ArrayDeque<>();
			queue.add(new int[] {rootIndex, 0});
			seen[rootIndex] = true;
			int maxDepth = 0;
			while (!queue.isEmpty()) {
				int[] entry = queue.poll();
				maxDepth = Math.max(maxDepth, entry[1]);
				for (TreeEdge edge : outgoing.get(entry[0])) {
					int child = indexById.get(edge.target());
					seen[child] = true;
					queue.add(new int[] {child, entry[1] + 1});
				}
			}
			for (int i = 0; i < seen.length; i++) {
				if (!seen[i]) {
					throw new TreeStructureException(
							"Node " + nodes.get(i).id() + " is not reachable from the root (cycle)", nodes.get(i).id());
				}
			}
			return maxDepth;
		}
	}
}
