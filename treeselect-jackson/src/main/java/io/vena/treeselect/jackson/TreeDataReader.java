package io.vena.treeselect.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.treeselect.RawNode;
import io.vena.treeselect.SelectionValue;
import io.vena.treeselect.SimpleModeConfig;
import io.vena.treeselect.SimpleTreeData;
import io.vena.treeselect.WrappedValue;
import io.vena.treeselect.exceptions.TreeDataException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tree data and selections from JSON.
 *
 * <p>
 * A tree document is either an array of nodes or a single node object;
 * <code>null</code> reads as an empty tree. Null array elements are kept as
 * null nodes, which the indexer skips without renumbering their siblings. Failures are reported as
 * {@link TreeDataException}.
 */
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class TreeDataReader {
	@Getter private final ObjectMapper mapper;

	public TreeDataReader() {
		this(new ObjectMapper().registerModule(new TreeSelectJacksonModule()));
	}

	public List<RawNode> readTree(String json) {
		try {
			return nodesFrom(mapper.readTree(json));
		} catch (JsonProcessingException e) {
			throw new TreeDataException("Unable to read tree data", e);
		}
	}

	public List<RawNode> readTree(InputStream json) {
		try {
			return nodesFrom(mapper.readTree(json));
		} catch (IOException e) {
			throw new TreeDataException("Unable to read tree data", e);
		}
	}

	/**
	 * Reads a flat table of rows and links them with {@link SimpleTreeData}.
	 */
	public List<RawNode> readSimpleTree(String json, SimpleModeConfig config) {
		try {
			List<Map<String, Object>> rows = mapper.readValue(json, ROWS);
			return SimpleTreeData.parse(rows, config);
		} catch (JsonProcessingException e) {
			throw new TreeDataException("Unable to read simple-mode tree data", e);
		}
	}

	/**
	 * A selection document is an array whose elements are either bare values
	 * or <code>{"value": ..., "label": ...}</code> objects.
	 */
	public List<WrappedValue> readSelection(String json) {
		try {
			List<WrappedValue> result = mapper.readValue(json, WRAPPED_VALUES);
			return (result == null)? new ArrayList<>() : result;
		} catch (JsonProcessingException e) {
			throw new TreeDataException("Unable to read selection", e);
		}
	}

	public String writeTree(List<RawNode> nodes) {
		try {
			return mapper.writeValueAsString(nodes);
		} catch (JsonProcessingException e) {
			throw new TreeDataException("Unable to write tree data", e);
		}
	}

	public String writeSelection(List<SelectionValue> values) {
		try {
			return mapper.writeValueAsString(values);
		} catch (JsonProcessingException e) {
			throw new TreeDataException("Unable to write selection", e);
		}
	}

	private List<RawNode> nodesFrom(JsonNode json) throws JsonProcessingException {
		List<RawNode> result = new ArrayList<>();
		if (json == null || json.isNull() || json.isMissingNode()) {
			return result;
		} else if (json.isArray()) {
			// Nulls stay, so ordinals match array indices
			for (JsonNode element: json) {
				result.add(element.isNull()? null : mapper.treeToValue(element, RawNode.class));
			}
		} else {
			result.add(mapper.treeToValue(json, RawNode.class));
		}
		LOGGER.debug("Read {} top-level nodes", result.size());
		return result;
	}

	private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() { };
	private static final TypeReference<List<WrappedValue>> WRAPPED_VALUES = new TypeReference<>() { };

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeDataReader.class);
}
