package io.vena.treeselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Walks a tree of {@link RawNode}s and builds an {@link EntityIndex}.
 *
 * <p>
 * Nodes are visited depth-first in pre-order, and each gets the position
 * <code>parentPos + "-" + index</code>, with top-level nodes hanging off
 * {@link Position#root()}. A node's key is the first of these that is usable:
 *
 * <ol>
 *     <li>its own {@link RawNode#key() key}, if non-empty;</li>
 *     <li>the text of its {@link RawNode#value() value}, if present
 *     (null, the empty string, <code>false</code> and NaN are not; zero is);</li>
 *     <li>{@link #KEY_OF_VALUE_EMPTY}.</li>
 * </ol>
 *
 * Each call builds everything from scratch. The only state carried between
 * calls is the label deprecation latch in the {@link TreeSelectContext}.
 */
@RequiredArgsConstructor
public final class EntityIndexer {
	private final TreeSelectContext context;

	public EntityIndexer() {
		this(TreeSelectContext.global());
	}

	public EntityIndex index(List<RawNode> data) {
		if (data == null || data.isEmpty()) {
			return new EntityIndex(data, emptyList(), emptyMap(), emptyMap(), emptyMap());
		}

		List<Draft> drafts = new ArrayList<>();
		Map<String, Integer> handlesByPos = new LinkedHashMap<>();

		Deque<Visit> stack = new ArrayDeque<>();
		pushAll(stack, data, Position.root());
		while (!stack.isEmpty()) {
			Visit visit = stack.pop();
			RawNode node = visit.node();
			Position pos = visit.position();

			Integer parentHandle = handlesByPos.get(pos.parent().toString());
			Draft draft = new Draft(drafts.size(), keyFor(node), node, pos, parentHandle);
			drafts.add(draft);
			if (parentHandle != null) {
				drafts.get(parentHandle).addChild(draft.handle);
			}
			handlesByPos.put(pos.toString(), draft.handle);

			warnIfDeprecatedLabel(node);
			pushAll(stack, node.children(), pos);
		}

		List<TreeEntity> arena = new ArrayList<>(drafts.size());
		Map<Object, TreeEntity> valueEntities = new LinkedHashMap<>();
		Map<String, TreeEntity> keyEntities = new LinkedHashMap<>();
		Map<String, TreeEntity> posEntities = new LinkedHashMap<>();
		for (Draft draft: drafts) {
			TreeEntity entity = draft.freeze();
			arena.add(entity);
			valueEntities.put(entity.value(), entity);
			TreeEntity shadowed = keyEntities.put(entity.key(), entity);
			if (shadowed != null) {
				LOGGER.debug("Key \"{}\" at {} replaces the entity at {}", entity.key(), entity.position(), shadowed.position());
			}
			posEntities.put(entity.pos(), entity);
		}
		LOGGER.debug("Indexed {} nodes", arena.size());
		return new EntityIndex(data,
			unmodifiableList(arena),
			unmodifiableMap(valueEntities),
			unmodifiableMap(keyEntities),
			unmodifiableMap(posEntities));
	}

	private static void pushAll(Deque<Visit> stack, List<RawNode> nodes, Position parentPos) {
		// Reverse order so the first sibling pops first
		for (int i = nodes.size() - 1; i >= 0; i--) {
			RawNode node = nodes.get(i);
			if (node != null) {
				stack.push(new Visit(node, parentPos.child(i)));
			}
		}
	}

	static String keyFor(RawNode node) {
		String key = node.key();
		if (key != null && !key.isEmpty()) {
			return key;
		}
		Object value = node.value();
		if (isPresent(value)) {
			return value.toString();
		}
		return KEY_OF_VALUE_EMPTY;
	}

	/**
	 * Numeric zero counts as present: it's a perfectly good value.
	 */
	static boolean isPresent(Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return false;
		} else if (value instanceof CharSequence) {
			return ((CharSequence) value).length() != 0;
		} else if (value instanceof Double) {
			return !((Double) value).isNaN();
		} else if (value instanceof Float) {
			return !((Float) value).isNaN();
		} else {
			return true;
		}
	}

	@SuppressWarnings("deprecation")
	private void warnIfDeprecatedLabel(RawNode node) {
		boolean hasTitle = node.title() != null && !node.title().isEmpty();
		boolean hasLabel = node.label() != null && !node.label().isEmpty();
		if (hasLabel && !hasTitle && context.claimLabelDeprecationWarning()) {
			LOGGER.warn("'label' in tableData is deprecated. Please use 'title' instead.");
		}
	}

	private record Visit(RawNode node, Position position) { }

	private static final class Draft {
		final int handle;
		final String key;
		final RawNode node;
		final Position position;
		final Integer parent;
		List<Integer> children;

		Draft(int handle, String key, RawNode node, Position position, Integer parent) {
			this.handle = handle;
			this.key = key;
			this.node = node;
			this.position = position;
			this.parent = parent;
		}

		void addChild(int childHandle) {
			if (children == null) {
				children = new ArrayList<>();
			}
			children.add(childHandle);
		}

		TreeEntity freeze() {
			return new TreeEntity(handle, key, node.value(), position, node, parent,
				(children == null)? null : List.copyOf(children));
		}
	}

	/**
	 * Stands in for the key of a node that has neither a key nor a value.
	 */
	public static final String KEY_OF_VALUE_EMPTY = "RC_TREE_SELECT_KEY_OF_VALUE_EMPTY";

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityIndexer.class);
}
