package org.javai.bonsai.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.bonsai.TreeStructureException;
import org.javai.bonsai.UnknownConditionKindException;
import org.javai.bonsai.UnknownNodeKindException;
import org.javai.bonsai.ValueFormatException;
import org.javai.bonsai.tree.BonsaiTree;
import org.javai.bonsai.tree.Condition;
import org.javai.bonsai.tree.NodeState;
import org.javai.bonsai.tree.TreeEdge;
import org.javai.bonsai.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON document a tree producer emits into a {@link BonsaiTree}.
 *
 * <p>Example document:
 * <pre>
 * {
 *   "nodes": [
 *     {"id": 0, "kind": "split", "feature": "segment"},
 *     {"id": 1, "kind": "leaf", "output": 0.2, "state": {"segment": 12345}},
 *     {"id": 2, "kind": "default_leaf", "output": 0.05}
 *   ],
 *   "edges": [
 *     {"source": 0, "target": 1, "type": "assignment", "value": 12345},
 *     {"source": 0, "target": 2}
 *   ]
 * }
 * </pre>
 *
 * <p>State entries are read by shape: a scalar is an assignment, an array a membership
 * and an object with {@code lower} / {@code upper} a range. Structural checks are left to
 * {@link BonsaiTree.Builder#build()}.
 */
public class BonsaiTreeJsonReader {

	private static final Logger logger = LoggerFactory.getLogger(BonsaiTreeJsonReader.class);

	private final ObjectMapper mapper;

	public BonsaiTreeJsonReader() {
		this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
	}

	public BonsaiTreeJsonReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public BonsaiTree read(String json) {
		try {
			return read(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new TreeStructureException("Tree document is not valid JSON: " + e.getOriginalMessage(), null, e);
		}
	}

	public BonsaiTree read(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return read(reader);
		} catch (IOException e) {
			throw new TreeStructureException("Failed to read tree document from path: " + path, null, e);
		}
	}

	public BonsaiTree read(InputStream inputStream) {
		try {
			return read(mapper.readTree(inputStream));
		} catch (IOException e) {
			throw new TreeStructureException("Failed to read tree document from input stream", null, e);
		}
	}

	public BonsaiTree read(Reader reader) {
		try {
			return read(mapper.readTree(reader));
		} catch (IOException e) {
			throw new TreeStructureException("Failed to read tree document from reader", null, e);
		}
	}

	public BonsaiTree read(JsonNode document) {
		if (document == null || !document.isObject()) {
			throw new TreeStructureException("Tree document must be a JSON object", null);
		}
		JsonNode nodes = document.path("nodes");
		JsonNode edges = document.path("edges");
		if (!nodes.isArray()) {
			throw new TreeStructureException("Tree document has no 'nodes' array", null);
		}
		if (!edges.isMissingNode() && !edges.isArray()) {
			throw new TreeStructureException("'edges' must be an array", null);
		}

		BonsaiTree.Builder builder = BonsaiTree.builder();
		for (JsonNode node : nodes) {
			builder.node(toNode(node));
		}
		for (JsonNode edge : edges) {
			builder.edge(toEdge(edge));
		}
		BonsaiTree tree = builder.build();
		logger.debug("Read tree document with {} nodes and {} edges", nodes.size(), edges.size());
		return tree;
	}

	private TreeNode toNode(JsonNode node) {
		String id = requiredId(node, "id", null);
		String kind = node.path("kind").asText("");
		NodeState state = toState(node.path("state"), id);
		return switch (kind) {
			case "split" -> {
				String feature = node.path("feature").asText("");
				if (feature.isEmpty()) {
					throw new TreeStructureException("Split " + id + " has no 'feature'", id);
				}
				yield new TreeNode.Split(id, feature, state);
			}
			case "leaf", "default_leaf" -> {
				boolean noBid = node.path("no_bid").asBoolean(false);
				boolean smart = node.path("smart").asBoolean(false);
				Optional<String> label = node.hasNonNull("label")
						? Optional.of(node.get("label").asText())
						: Optional.empty();
				if (smart && label.isEmpty()) {
					throw new TreeStructureException("Smart leaf " + id + " has no 'label'", id);
				}
				double output = output(node, id, noBid);
				yield kind.equals("leaf")
						? new TreeNode.Leaf(id, output, noBid, label, smart, state)
						: new TreeNode.DefaultLeaf(id, output, noBid, label, smart, state);
			}
			default -> throw new UnknownNodeKindException(kind, id);
		};
	}

	private TreeEdge toEdge(JsonNode edge) {
		String source = requiredId(edge, "source", null);
		String target = requiredId(edge, "target", source);
		String type = edge.hasNonNull("type") ? edge.get("type").asText() : "unconditional";
		Condition condition = switch (type) {
			case "assignment" -> {
				JsonNode value = edge.path("value");
				if (!value.isValueNode() || value.isNull()) {
					throw new TreeStructureException("Assignment edge " + source + " -> " + target
							+ " needs a scalar 'value'", source);
				}
				yield Condition.assignment(value.asText());
			}
			case "range" -> toRange(edge, source);
			case "membership" -> new Condition.Membership(values(edge.path("values"), source));
			case "unconditional" -> Condition.unconditional();
			default -> throw new UnknownConditionKindException(type, source);
		};
		return new TreeEdge(
				source,
				target,
				condition,
				edge.path("negated").asBoolean(false),
				edge.path("join_statement").asBoolean(false));
	}

	private NodeState toState(JsonNode state, String id) {
		if (state.isMissingNode() || state.isNull()) {
			return NodeState.empty();
		}
		if (!state.isObject()) {
			throw new TreeStructureException("State of node " + id + " must be an object", id);
		}
		NodeState result = NodeState.empty();
		Iterator<Map.Entry<String, JsonNode>> fields = state.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			JsonNode value = field.getValue();
			Condition constraint;
			if (value.isArray()) {
				constraint = new Condition.Membership(values(value, id));
			} else if (value.isObject()) {
				constraint = toRange(value, id);
			} else if (value.isValueNode() && !value.isNull()) {
				constraint = Condition.assignment(value.asText());
			} else {
				throw new TreeStructureException("State entry '" + field.getKey() + "' of node " + id
						+ " is empty", id);
			}
			result = result.with(field.getKey(), constraint);
		}
		return result;
	}

	private Condition.Range toRange(JsonNode holder, String id) {
		Optional<BigDecimal> lower = bound(holder.path("lower"), id);
		Optional<BigDecimal> upper = bound(holder.path("upper"), id);
		if (lower.isEmpty() && upper.isEmpty()) {
			throw new TreeStructureException("Range at node " + id + " has neither 'lower' nor 'upper'", id);
		}
		return new Condition.Range(lower, upper);
	}

	private Optional<BigDecimal> bound(JsonNode bound, String id) {
		if (bound.isMissingNode() || bound.isNull()) {
			return Optional.empty();
		}
		if (!bound.isNumber()) {
			throw new TreeStructureException("Range bound at node " + id + " is not a number: " + bound, id);
		}
		return Optional.of(bound.decimalValue());
	}

	private List<String> values(JsonNode array, String id) {
		if (!array.isArray() || array.isEmpty()) {
			throw new TreeStructureException("Membership at node " + id + " needs a non-empty 'values' array", id);
		}
		List<String> values = new ArrayList<>(array.size());
		for (JsonNode value : array) {
			if (!value.isValueNode() || value.isNull()) {
				throw new TreeStructureException("Membership at node " + id + " has a non-scalar value: " + value, id);
			}
			values.add(value.asText());
		}
		return values;
	}

	private static double output(JsonNode node, String id, boolean noBid) {
		JsonNode output = node.path("output");
		if (output.isNumber()) {
			return output.asDouble();
		}
		if (output.isMissingNode() || output.isNull()) {
			if (noBid) {
				return 0.0;
			}
			throw new TreeStructureException("Leaf " + id + " needs a numeric 'output'", id);
		}
		throw new ValueFormatException("Leaf " + id + " has a non-numeric output: " + output, id);
	}

	private static String requiredId(JsonNode holder, String field, String context) {
		JsonNode value = holder.path(field);
		if (!value.isTextual() && !value.isIntegralNumber()) {
			throw new TreeStructureException("Missing or invalid '" + field + "'", context);
		}
		return value.asText();
	}
}
