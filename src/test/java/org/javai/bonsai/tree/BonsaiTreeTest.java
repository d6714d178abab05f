package org.javai.bonsai.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import org.javai.bonsai.TreeStructureException;
import org.javai.bonsai.testsupport.SampleTrees;
import org.junit.jupiter.api.Test;

class BonsaiTreeTest {

	@Test
	void exposesRootChildrenAndParents() {
		BonsaiTree tree = SampleTrees.twoSegmentsTwoGeos();

		assertThat(tree.root().id()).isEqualTo("0");
		assertThat(tree.size()).isEqualTo(22);
		assertThat(tree.depth()).isEqualTo(3);
		assertThat(tree.outgoingEdges("0"))
			.extracting(TreeEdge::target)
			.containsExactly("1", "2", "15");
		assertThat(tree.parentEdge("0")).isEmpty();
		assertThat(tree.parentEdge("7")).hasValueSatisfying(edge -> {
			assertThat(edge.source()).isEqualTo("3");
			assertThat(edge.condition()).isEqualTo(Condition.membership("UK", "DE"));
		});
		assertThat(tree.outgoingEdges("7")).isEmpty();
	}

	@Test
	void nodeVariantsAreKeptAsBuilt() {
		BonsaiTree tree = SampleTrees.twoSegmentsTwoGeos();

		assertThat(tree.node("1")).isInstanceOfSatisfying(TreeNode.Split.class,
			split -> assertThat(split.feature()).isEqualTo("age"));
		assertThat(tree.node("8")).isInstanceOfSatisfying(TreeNode.Leaf.class,
			leaf -> assertThat(leaf.output()).isEqualTo(0.20));
		assertThat(tree.node("21")).isInstanceOf(TreeNode.DefaultLeaf.class);
		assertThat(tree.node("5").state().constraint("segment")).contains(Condition.assignment(67890));
	}

	@Test
	void unknownIdIsRejectedOnLookup() {
		BonsaiTree tree = SampleTrees.twoSegmentsTwoGeos();

		assertThatThrownBy(() -> tree.node("99"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("99");
	}

	@Test
	void acceptDispatchesToTheMatchingVisitMethod() {
		@SuppressWarnings("unchecked")
		TreeNodeVisitor<String> visitor = mock(TreeNodeVisitor.class);
		TreeNode.Split split = new TreeNode.Split("s", "geo", NodeState.empty());
		TreeNode.Leaf leaf = TreeNode.Leaf.of("l", 0.5, NodeState.empty());
		TreeNode.DefaultLeaf defaultLeaf = TreeNode.DefaultLeaf.of("d", 0.1, NodeState.empty());

		split.accept(visitor);
		leaf.accept(visitor);
		defaultLeaf.accept(visitor);

		verify(visitor).visitSplit(split);
		verify(visitor).visitLeaf(leaf);
		verify(visitor).visitDefaultLeaf(defaultLeaf);
		verifyNoMoreInteractions(visitor);
	}

	@Test
	void rejectsDuplicateIds() {
		BonsaiTree.Builder builder = BonsaiTree.builder().split("0", "segment", NodeState.empty());

		assertThatThrownBy(() -> builder.leaf("0", 0.1, NodeState.empty()))
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("Duplicate node id 0");
	}

	@Test
	void rejectsLeafWithOutgoingEdge() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "geo", NodeState.empty())
			.leaf("1", 0.1, NodeState.empty())
			.leaf("2", 0.2, NodeState.empty())
			.edge("0", "1", Condition.assignment("UK"))
			.edge("1", "2", Condition.assignment("DE"));

		assertThatThrownBy(builder::build)
			.isInstanceOfSatisfying(TreeStructureException.class,
				e -> assertThat(e.nodeId()).isEqualTo("1"))
			.hasMessageContaining("outgoing edge");
	}

	@Test
	void rejectsSharedChild() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.split("1", "geo", NodeState.empty())
			.leaf("2", 0.1, NodeState.empty())
			.edge("0", "1", Condition.assignment(1))
			.edge("0", "2", Condition.assignment(2))
			.edge("1", "2", Condition.assignment("UK"));

		assertThatThrownBy(builder::build)
			.isInstanceOfSatisfying(TreeStructureException.class,
				e -> assertThat(e.nodeId()).isEqualTo("2"))
			.hasMessageContaining("more than one parent");
	}

	@Test
	void rejectsSeveralRoots() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.leaf("1", 0.1, NodeState.empty())
			.leaf("2", 0.2, NodeState.empty())
			.edge("0", "1", Condition.assignment(1));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("more than one root");
	}

	@Test
	void rejectsCycleDetachedFromRoot() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.leaf("1", 0.1, NodeState.empty())
			.split("2", "geo", NodeState.empty())
			.split("3", "age", NodeState.empty())
			.edge("0", "1", Condition.assignment(1))
			.edge("2", "3", Condition.assignment("UK"))
			.edge("3", "2", Condition.atMost(10));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("not reachable from the root");
	}

	@Test
	void rejectsGraphWhereEveryNodeHasAParent() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.split("1", "geo", NodeState.empty())
			.edge("0", "1", Condition.assignment(1))
			.edge("1", "0", Condition.assignment("UK"));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("no root");
	}

	@Test
	void rejectsSelfLoop() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.edge("0", "0", Condition.assignment(1));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("edge to itself");
	}

	@Test
	void rejectsEdgeToUnknownNode() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.edge("0", "missing", Condition.assignment(1));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("unknown node missing");
	}

	@Test
	void rejectsConditionalEdgeIntoDefaultLeaf() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.leaf("1", 0.1, NodeState.empty())
			.defaultLeaf("2", 0.05, NodeState.empty())
			.edge("0", "1", Condition.assignment(1))
			.edge("0", "2", Condition.assignment(2));

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("default leaf");
	}

	@Test
	void rejectsSplitWithoutEdges() {
		BonsaiTree.Builder builder = BonsaiTree.builder()
			.split("0", "segment", NodeState.empty())
			.split("1", "geo", NodeState.empty())
			.fallbackEdge("0", "1");

		assertThatThrownBy(builder::build)
			.isInstanceOfSatisfying(TreeStructureException.class,
				e -> assertThat(e.nodeId()).isEqualTo("1"))
			.hasMessageContaining("no outgoing edges");
	}

	@Test
	void rejectsLeafAsRoot() {
		BonsaiTree.Builder builder = BonsaiTree.builder().leaf("0", 0.1, NodeState.empty());

		assertThatThrownBy(builder::build)
			.isInstanceOf(TreeStructureException.class)
			.hasMessageContaining("is not a split");
	}

	@Test
	void rejectsEmptyTree() {
		assertThatThrownBy(() -> BonsaiTree.builder().build())
			.isInstanceOf(TreeStructureException.class);
	}
}
