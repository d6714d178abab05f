package org.javai.bonsai.render;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.bonsai.ValueFormatException;
import org.javai.bonsai.tree.TreeNode;

/**
 * Renders leaf outputs and edge values as literals of the bidding language.
 * Output never depends on the default locale.
 */
public class ValueFormatter {

	/**
	 * Token written in place of a bid for leaves that must not bid.
	 */
	public static final String NO_BID = "no_bid";

	private static final int OUTPUT_SCALE = 4;
	private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

	/**
	 * Formats a leaf's bid with exactly four decimals, or {@link #NO_BID}.
	 */
	public String formatOutput(TreeNode.Terminal leaf) {
		if (leaf.noBid()) {
			return NO_BID;
		}
		double output = leaf.output();
		if (!Double.isFinite(output)) {
			throw new ValueFormatException("Leaf " + leaf.id() + " has non-finite output " + output, leaf.id());
		}
		// exact binary value, so 0.125 and 0.00005 round the same way every time
		return new BigDecimal(output).setScale(OUTPUT_SCALE, RoundingMode.HALF_EVEN).toPlainString();
	}

	/**
	 * Numeric text as-is, anything else as a double-quoted string.
	 */
	public String formatScalar(String value) {
		return isNumeric(value) ? value : quote(value);
	}

	/**
	 * Integral bounds print without a fraction, others in plain notation.
	 */
	public String formatBound(BigDecimal bound) {
		BigDecimal stripped = bound.stripTrailingZeros();
		if (stripped.scale() <= 0) {
			return stripped.toBigInteger().toString();
		}
		return stripped.toPlainString();
	}

	/**
	 * Parenthesised, comma-separated list in the given order.
	 */
	public String formatMembers(List<String> values) {
		return values.stream()
			.map(this::formatScalar)
			.collect(Collectors.joining(", ", "(", ")"));
	}

	public String quote(String value) {
		return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
	}

	boolean isNumeric(String value) {
		return value != null && NUMBER.matcher(value).matches();
	}
}
