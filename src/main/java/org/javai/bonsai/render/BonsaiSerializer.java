package org.javai.bonsai.render;

import java.util.List;
import org.javai.bonsai.tree.BonsaiTree;
import org.javai.bonsai.tree.TreeEdge;
import org.javai.bonsai.tree.TreeNode;
import org.javai.bonsai.tree.TreeNodeVisitor;

/**
 * Visitor that writes a tree as nested {@code if} / {@code elif} / {@code else} blocks.
 * <p>
 * One instance renders one tree; output accumulates in memory and is only handed out
 * once the whole walk succeeded.
 */
public class BonsaiSerializer implements TreeNodeVisitor<Void> {

	static final String INDENT = "    ";

	private final StringBuilder output = new StringBuilder();
	private final BonsaiTree tree;
	private final ConditionRenderer conditions;
	private final BranchOrderer orderer;
	private final ValueFormatter formatter;
	private int indentLevel = 0;
	private int lines = 0;

	public BonsaiSerializer(BonsaiTree tree, ConditionRenderer conditions, BranchOrderer orderer,
			ValueFormatter formatter) {
		this.tree = tree;
		this.conditions = conditions;
		this.orderer = orderer;
		this.formatter = formatter;
	}

	@Override
	public Void visitSplit(TreeNode.Split split) {
		OrderedBranches branches = orderer.order(tree, split);
		List<TreeEdge> conditional = branches.conditional();
		for (int i = 0; i < conditional.size(); i++) {
			TreeEdge edge = conditional.get(i);
			String keyword = i == 0 ? "if " : "elif ";
			line(keyword + conditions.render(split, edge) + ":");
			body(edge);
		}
		line("else:");
		body(branches.fallback());
		return null;
	}

	@Override
	public Void visitLeaf(TreeNode.Leaf leaf) {
		terminal(leaf);
		return null;
	}

	@Override
	public Void visitDefaultLeaf(TreeNode.DefaultLeaf defaultLeaf) {
		terminal(defaultLeaf);
		return null;
	}

	private void terminal(TreeNode.Terminal terminal) {
		if (terminal.smart()) {
			line("leaf_name: " + formatter.quote(terminal.label().orElseThrow()));
		}
		line(formatter.formatOutput(terminal));
	}

	private void body(TreeEdge edge) {
		indentLevel++;
		tree.node(edge.target()).accept(this);
		indentLevel--;
	}

	private void line(String text) {
		output.append(INDENT.repeat(indentLevel)).append(text).append('\n');
		lines++;
	}

	int lineCount() {
		return lines;
	}

	/**
	 * Returns the rendered program.
	 */
	@Override
	public String toString() {
		return output.toString();
	}
}
