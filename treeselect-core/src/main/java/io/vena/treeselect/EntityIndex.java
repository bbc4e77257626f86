package io.vena.treeselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.toList;

/**
 * The result of one {@link EntityIndexer#index} call: an arena of
 * {@link TreeEntity} objects plus three lookup tables over it.
 *
 * <p>
 * The tables are insertion-ordered (pre-order traversal) and immutable.
 * When two nodes share a key, value, or position text, the later one wins.
 */
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class EntityIndex {
	/**
	 * The exact list that was indexed; may be null.
	 */
	@Getter private final @Nullable List<RawNode> data;
	private final List<TreeEntity> arena;
	@Getter private final Map<Object, TreeEntity> valueEntities;
	@Getter private final Map<String, TreeEntity> keyEntities;
	@Getter private final Map<String, TreeEntity> posEntities;

	public static EntityIndex empty() {
		return new EntityIndex(null, emptyList(), emptyMap(), emptyMap(), emptyMap());
	}

	public int size() {
		return arena.size();
	}

	public boolean isEmpty() {
		return arena.isEmpty();
	}

	/**
	 * All entities in pre-order, including any shadowed by a duplicate key.
	 */
	public List<TreeEntity> entities() {
		return unmodifiableList(arena);
	}

	public TreeEntity entity(int handle) {
		return arena.get(handle);
	}

	public @Nullable TreeEntity forKey(String key) {
		return keyEntities.get(key);
	}

	public @Nullable TreeEntity forValue(@Nullable Object value) {
		return valueEntities.get(value);
	}

	public @Nullable TreeEntity forPosition(String pos) {
		return posEntities.get(pos);
	}

	public boolean containsKey(String key) {
		return keyEntities.containsKey(key);
	}

	public @Nullable TreeEntity parentOf(TreeEntity entity) {
		Integer parent = entity.parent();
		if (parent == null) {
			return null;
		} else {
			return arena.get(parent);
		}
	}

	public List<TreeEntity> childrenOf(TreeEntity entity) {
		List<Integer> children = entity.children();
		if (children == null) {
			return emptyList();
		} else {
			return children.stream().map(arena::get).collect(toList());
		}
	}

	/**
	 * @return every descendant of <code>entity</code> in pre-order, not including <code>entity</code> itself.
	 */
	public List<TreeEntity> descendantsOf(TreeEntity entity) {
		List<TreeEntity> result = new ArrayList<>();
		Deque<TreeEntity> stack = new ArrayDeque<>();
		pushChildren(stack, entity);
		while (!stack.isEmpty()) {
			TreeEntity next = stack.pop();
			result.add(next);
			pushChildren(stack, next);
		}
		return result;
	}

	/**
	 * @return the parent, grandparent, and so on up to the root.
	 */
	public List<TreeEntity> ancestorsOf(TreeEntity entity) {
		List<TreeEntity> result = new ArrayList<>();
		for (TreeEntity a = parentOf(entity); a != null; a = parentOf(a)) {
			result.add(a);
		}
		return result;
	}

	private void pushChildren(Deque<TreeEntity> stack, TreeEntity entity) {
		List<Integer> children = entity.children();
		if (children != null) {
			// Reverse order so they pop in source order
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(arena.get(children.get(i)));
			}
		}
	}

	@Override
	public String toString() {
		return "EntityIndex" + keyEntities.keySet();
	}
}
