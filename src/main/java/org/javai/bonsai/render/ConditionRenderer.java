package org.javai.bonsai.render;

import java.util.Optional;
import org.javai.bonsai.TreeStructureException;
import org.javai.bonsai.UnknownConditionKindException;
import org.javai.bonsai.ValueFormatException;
import org.javai.bonsai.dialect.AssignmentStyle;
import org.javai.bonsai.dialect.BonsaiDialect;
import org.javai.bonsai.dialect.FeatureDefinition;
import org.javai.bonsai.tree.Condition;
import org.javai.bonsai.tree.TreeEdge;
import org.javai.bonsai.tree.TreeNode;

/**
 * Turns one edge into the boolean expression written after {@code if} / {@code elif}.
 * <p>
 * Operators follow the split feature's declared typing in the {@link BonsaiDialect}:
 * <ul>
 *   <li>assignment: {@code segment 12345} (bare) or {@code os="ios"}</li>
 *   <li>range: {@code age <= 10} when the lower side is open, {@code age > 10} when the upper side is</li>
 *   <li>membership: {@code geo in ("UK", "DE")}, order preserved</li>
 * </ul>
 * A join statement prefixes the test with {@code every}, or {@code not every} when negated.
 */
public class ConditionRenderer {

	private final BonsaiDialect dialect;
	private final ValueFormatter formatter;

	public ConditionRenderer(BonsaiDialect dialect, ValueFormatter formatter) {
		this.dialect = dialect;
		this.formatter = formatter;
	}

	public String render(TreeNode.Split source, TreeEdge edge) {
		String feature = featureText(source);
		boolean inlineNegation = edge.negated() && !edge.joinStatement();
		Condition condition = edge.condition();

		String test;
		if (condition instanceof Condition.Assignment assignment) {
			test = renderAssignment(source.feature(), feature, assignment);
		} else if (condition instanceof Condition.Range range) {
			test = renderRange(feature, range, edge);
		} else if (condition instanceof Condition.Membership membership) {
			String operator = inlineNegation ? " not in " : " in ";
			return prefix(edge) + feature + operator + formatter.formatMembers(membership.values());
		} else if (condition instanceof Condition.Unconditional) {
			throw new TreeStructureException(
					"Edge " + edge.describe() + " is unconditional and can only be rendered as else", source.id());
		} else {
			throw new UnknownConditionKindException(condition.kind(), source.id());
		}

		if (inlineNegation) {
			return "not " + test;
		}
		return prefix(edge) + test;
	}

	/**
	 * The feature as written in conditions, qualified by an ancestor's assignment where
	 * the dialect asks for it, e.g. {@code segment[12345].age}.
	 */
	public String featureText(TreeNode.Split source) {
		String feature = source.feature();
		FeatureDefinition definition = dialect.feature(feature);
		Optional<String> qualifier = definition.qualifier();
		if (qualifier.isEmpty()) {
			return feature;
		}
		Condition constraint = source.state().constraint(qualifier.get())
			.orElseThrow(() -> new TreeStructureException("Split " + source.id() + " on '" + feature
					+ "' has no '" + qualifier.get() + "' in its state to qualify it", source.id()));
		if (!(constraint instanceof Condition.Assignment assigned)) {
			throw new TreeStructureException("Split " + source.id() + " on '" + feature + "' needs a single '"
					+ qualifier.get() + "' value, state has a " + constraint.kind(), source.id());
		}
		return qualifier.get() + "[" + assigned.value() + "]." + feature;
	}

	private String renderAssignment(String featureName, String feature, Condition.Assignment assignment) {
		AssignmentStyle style = dialect.feature(featureName).assignment();
		String value = formatter.formatScalar(assignment.value());
		if (style == AssignmentStyle.bare) {
			return feature + " " + value;
		}
		return feature + "=" + value;
	}

	private String renderRange(String feature, Condition.Range range, TreeEdge edge) {
		if (range.lower().isPresent() && range.upper().isPresent()) {
			throw new ValueFormatException("Range on edge " + edge.describe()
					+ " has two finite bounds; conditions take one", edge.source());
		}
		if (range.lower().isEmpty()) {
			return feature + " <= " + formatter.formatBound(range.upper().get());
		}
		return feature + " > " + formatter.formatBound(range.lower().get());
	}

	private static String prefix(TreeEdge edge) {
		if (!edge.joinStatement()) {
			return "";
		}
		return edge.negated() ? "not every " : "every ";
	}
}
