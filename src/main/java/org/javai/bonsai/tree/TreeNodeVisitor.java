package org.javai.bonsai.tree;

/**
 * Visitor over the node variants of a {@link BonsaiTree}.
 *
 * @param <R> the return type of the visitor operations
 */
public interface TreeNodeVisitor<R> {

	R visitSplit(TreeNode.Split split);

	R visitLeaf(TreeNode.Leaf leaf);

	R visitDefaultLeaf(TreeNode.DefaultLeaf defaultLeaf);
}
