package org.javai.bonsai.render;

import java.util.List;
import org.javai.bonsai.dialect.BonsaiDialect;
import org.javai.bonsai.tree.BonsaiTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: renders a {@link BonsaiTree} as a program of the Bonsai bidding language.
 * <p>
 * Rendering is all-or-nothing. Any {@link org.javai.bonsai.BonsaiException} propagates to the
 * caller and no text is returned. Instances hold no per-render state and may be shared.
 */
public class BonsaiRenderer {

	private static final Logger logger = LoggerFactory.getLogger(BonsaiRenderer.class);

	private final ValueFormatter formatter;
	private final ConditionRenderer conditions;
	private final BranchOrderer orderer;

	public BonsaiRenderer() {
		this(BonsaiDialect.defaults());
	}

	public BonsaiRenderer(BonsaiDialect dialect) {
		this.formatter = new ValueFormatter();
		this.conditions = new ConditionRenderer(dialect, formatter);
		this.orderer = new BranchOrderer(dialect);
	}

	public String render(BonsaiTree tree) {
		BonsaiSerializer serializer = createSerializer(tree);
		tree.root().accept(serializer);
		logger.debug("Rendered tree of {} nodes (depth {}) into {} lines",
				tree.size(), tree.depth(), serializer.lineCount());
		return serializer.toString();
	}

	public BonsaiProgram render(BonsaiTree tree, List<String> header) {
		return new BonsaiProgram(header, render(tree));
	}

	protected BonsaiSerializer createSerializer(BonsaiTree tree) {
		return new BonsaiSerializer(tree, conditions, orderer, formatter);
	}
}
