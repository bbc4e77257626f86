package io.vena.treeselect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a tree out of a flat table in which each row names its parent's id.
 *
 * <p>
 * A row is top-level if its parent id equals {@link SimpleModeConfig#getRootPId()},
 * or if the root parent id is null and the row's parent id matches no row.
 * Rows keep their table order among their siblings. A row whose parent id
 * refers to a missing row, when the root parent id is not null, is dropped.
 *
 * <p>
 * The <code>key</code>, <code>title</code>, <code>label</code> and
 * <code>value</code> fields of a row become the corresponding {@link RawNode}
 * fields; everything else, including the id columns, becomes an attribute.
 */
public final class SimpleTreeData {
	private SimpleTreeData() { }

	public static List<RawNode> parse(List<? extends Map<String, ?>> rows, SimpleModeConfig config) {
		if (rows == null || rows.isEmpty()) {
			return new ArrayList<>();
		}
		Map<Object, Row> rowsById = new LinkedHashMap<>();
		List<Row> allRows = new ArrayList<>(rows.size());
		for (Map<String, ?> fields: rows) {
			Row row = new Row(fields);
			rowsById.put(fields.get(config.getId()), row);
			allRows.add(row);
		}

		List<Row> roots = new ArrayList<>();
		for (Row row: allRows) {
			Object parentId = row.fields.get(config.getPId());
			Row parent = rowsById.get(parentId);
			if (parent != null) {
				parent.children.add(row);
			}
			if (Objects.equals(parentId, config.getRootPId()) || (parent == null && config.getRootPId() == null)) {
				roots.add(row);
			}
		}

		List<RawNode> result = new ArrayList<>(roots.size());
		for (Row root: roots) {
			result.add(toNode(root, new HashSet<>()));
		}
		return result;
	}

	/**
	 * @param path rows between the top level and <code>row</code>, to stop cycles
	 */
	private static RawNode toNode(Row row, Set<Row> path) {
		path.add(row);
		RawNode.RawNodeBuilder builder = RawNode.builder();
		row.fields.forEach((name, value) -> {
			switch (name) {
				case "key":
					builder.key((value == null)? null : value.toString());
					break;
				case "title":
					builder.title((value == null)? null : value.toString());
					break;
				case "label":
					setLabel(builder, value);
					break;
				case "value":
					builder.value(value);
					break;
				default:
					builder.attribute(name, value);
			}
		});
		for (Row child: row.children) {
			if (path.contains(child)) {
				LOGGER.warn("Ignoring cyclic parent reference to {}", child.fields);
			} else {
				builder.child(toNode(child, path));
			}
		}
		path.remove(row);
		return builder.build();
	}

	@SuppressWarnings("deprecation")
	private static void setLabel(RawNode.RawNodeBuilder builder, Object value) {
		builder.label((value == null)? null : value.toString());
	}

	/**
	 * Identity semantics: two rows with equal fields are still distinct rows.
	 */
	private static final class Row {
		final Map<String, ?> fields;
		final List<Row> children = new ArrayList<>();

		Row(Map<String, ?> fields) {
			this.fields = fields;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SimpleTreeData.class);
}
