package io.vena.treeselect.jackson;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.vena.treeselect.CheckedStrategy;
import io.vena.treeselect.ConductionResult;
import io.vena.treeselect.EntityIndex;
import io.vena.treeselect.RawNode;
import io.vena.treeselect.SelectionValue;
import io.vena.treeselect.SelectorConfig;
import io.vena.treeselect.SimpleModeConfig;
import io.vena.treeselect.TreeSelect;
import io.vena.treeselect.TreeSelectContext;
import io.vena.treeselect.WrappedValue;
import io.vena.treeselect.exceptions.TreeDataException;
import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class TreeDataReaderTest {
	private final TreeDataReader reader = new TreeDataReader();

	static final String NESTED = "[" +
		"{\"title\": \"Parent\", \"value\": \"p\", \"children\": [" +
			"{\"title\": \"Leaf 1\", \"value\": \"p1\", \"disabled\": true}," +
			"{\"title\": \"Leaf 2\", \"value\": \"p2\"}" +
		"]}," +
		"{\"title\": \"Other\", \"value\": \"o\"}" +
	"]";

	@Test
	void nestedTree() {
		List<RawNode> nodes = reader.readTree(NESTED);
		assertEquals(2, nodes.size());
		RawNode parent = nodes.get(0);
		assertEquals("Parent", parent.title());
		assertEquals("p", parent.value());
		assertEquals(List.of("p1", "p2"), parent.children().stream().map(RawNode::value).collect(toList()));
		assertEquals(true, parent.children().get(0).attributes().get("disabled"));
		assertTrue(nodes.get(1).isLeaf());
	}

	@Test
	void inputStream() {
		List<RawNode> nodes = reader.readTree(new ByteArrayInputStream(NESTED.getBytes(UTF_8)));
		assertEquals(reader.readTree(NESTED), nodes);
	}

	@Test
	void singleObject_isOneTopLevelNode() {
		List<RawNode> nodes = reader.readTree("{\"title\": \"Only\", \"value\": 1}");
		assertEquals(1, nodes.size());
		assertEquals(1, nodes.get(0).value());
	}

	@Test
	void childrenAsSingleObject() {
		RawNode node = reader.readTree("{\"value\": \"a\", \"children\": {\"value\": \"b\"}}").get(0);
		assertEquals(1, node.children().size());
		assertEquals("b", node.children().get(0).value());
	}

	@Test
	void nullChildren_keepTheirPlace() {
		RawNode node = reader.readTree("{\"value\": \"a\", \"children\": [null, {\"value\": \"b\"}]}").get(0);
		assertEquals(2, node.children().size());
		assertNull(node.children().get(0));

		EntityIndex index = new TreeSelect(new TreeSelectContext()).indexTree(List.of(node));
		assertEquals("0-0-1", index.forKey("b").pos());
	}

	@Test
	void nullTopLevelNodes_keepTheirPlace() {
		List<RawNode> nodes = reader.readTree("[{\"value\": \"a\"}, null, {\"value\": \"c\"}]");
		assertEquals(3, nodes.size());
		assertNull(nodes.get(1));

		EntityIndex index = new TreeSelect(new TreeSelectContext()).indexTree(nodes);
		assertEquals(2, index.size());
		assertEquals("0-2", index.forKey("c").pos());
	}

	@Test
	void nullChildren_writeThenRead() {
		String json = "[{\"value\":\"a\",\"children\":[null,{\"value\":\"b\"}]}]";
		assertEquals(json, reader.writeTree(reader.readTree(json)));
	}

	@Test
	void numericKey_readsAsText() {
		RawNode node = reader.readTree("[{\"key\": 42, \"value\": \"x\"}]").get(0);
		assertEquals("42", node.key());
	}

	@Test
	@SuppressWarnings("deprecation")
	void deprecatedLabel_isKept() {
		RawNode node = reader.readTree("[{\"label\": \"Old\", \"value\": \"x\"}]").get(0);
		assertEquals("Old", node.label());
		assertNull(node.title());
	}

	@Test
	void structuredAttributes() {
		RawNode node = reader.readTree("[{\"value\": \"x\", \"meta\": {\"owner\": \"ops\", \"tags\": [\"a\", \"b\"]}}]").get(0);
		Object meta = node.attributes().get("meta");
		assertThat(meta, instanceOf(Map.class));
		assertEquals("ops", ((Map<?, ?>) meta).get("owner"));
		assertEquals(List.of("a", "b"), ((Map<?, ?>) meta).get("tags"));
	}

	@ParameterizedTest
	@MethodSource("emptyDocuments")
	void emptyDocument_isEmptyTree(String json) {
		assertEquals(List.of(), reader.readTree(json));
	}

	static Stream<Arguments> emptyDocuments() {
		return Stream.of(
			arguments("null"),
			arguments("[]"),
			arguments(""));
	}

	@ParameterizedTest
	@MethodSource("badDocuments")
	void badDocument_throws(String json) {
		assertThrows(TreeDataException.class, () -> reader.readTree(json));
	}

	static Stream<Arguments> badDocuments() {
		return Stream.of(
			arguments("[{\"value\": "),
			arguments("[1, 2]"),
			arguments("\"text\""),
			arguments("{\"value\": \"a\", \"children\": [\"b\"]}"));
	}

	@Test
	void nonObjectNode_causeIsMismatch() {
		TreeDataException e = assertThrows(TreeDataException.class, () -> reader.readTree("[true]"));
		assertThat(e.getCause(), instanceOf(MismatchedInputException.class));
	}

	@Test
	void writeThenRead() {
		List<RawNode> nodes = reader.readTree(NESTED);
		assertEquals(nodes, reader.readTree(reader.writeTree(nodes)));
	}

	@Test
	void write_omitsEmptyChildren() {
		RawNode leaf = RawNode.builder().value("v").title("V").build();
		assertEquals("[{\"title\":\"V\",\"value\":\"v\"}]", reader.writeTree(List.of(leaf)));
	}

	@Test
	void selection_mixedEntries() {
		List<WrappedValue> values = reader.readSelection("[\"a\", {\"value\": 2, \"label\": \"Two\"}, {\"other\": 1}]");
		assertEquals(WrappedValue.of("a"), values.get(0));
		assertEquals(WrappedValue.of(2, "Two"), values.get(1));
		assertEquals(WrappedValue.of(Map.of("other", 1)), values.get(2), "An object without a value is itself the value");
	}

	@Test
	void selection_null() {
		assertEquals(List.of(), reader.readSelection("null"));
	}

	@Test
	void writeSelection() {
		String json = reader.writeSelection(List.of(SelectionValue.of("Node A", "a"), SelectionValue.of(null, 3)));
		assertEquals("[{\"label\":\"Node A\",\"value\":\"a\"},{\"label\":null,\"value\":3}]", json);
	}

	@Test
	void simpleTree() {
		String json = "[" +
			"{\"id\": 1, \"pId\": 0, \"title\": \"Root\", \"value\": \"r\"}," +
			"{\"id\": 2, \"pId\": 1, \"title\": \"Child\", \"value\": \"c\"}" +
		"]";
		List<RawNode> nodes = reader.readSimpleTree(json, SimpleModeConfig.builder().rootPId(0).build());
		assertEquals(1, nodes.size());
		assertEquals("r", nodes.get(0).value());
		assertEquals("c", nodes.get(0).children().get(0).value());
	}

	@Test
	void simpleTree_malformed() {
		assertThrows(TreeDataException.class, () -> reader.readSimpleTree("{", SimpleModeConfig.defaults()));
	}

	@Test
	void endToEnd() {
		TreeSelect treeSelect = new TreeSelect(new TreeSelectContext());
		EntityIndex index = treeSelect.indexTree(reader.readTree(NESTED));
		ConductionResult state = treeSelect.conductCheck(index, List.of("p1", "p2"));
		assertTrue(state.isChecked("p"));

		SelectorConfig config = SelectorConfig.builder()
			.rowCheckable(true)
			.showCheckedStrategy(CheckedStrategy.SHOW_PARENT)
			.build();
		List<WrappedValue> selection = reader.readSelection("[\"p\", \"p1\", \"p2\"]");
		assertEquals(
			"[{\"label\":\"Parent\",\"value\":\"p\"}]",
			reader.writeSelection(treeSelect.formatSelection(selection, config, index)));
	}
}
