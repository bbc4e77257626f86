package io.vena.treeselect;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.experimental.Accessors;

import static java.util.Collections.unmodifiableList;

/**
 * A node of a forest rebuilt by {@link HierarchyReconstructor}.
 *
 * <p>
 * Wraps a {@link TreeEntity} without modifying it. The {@link #children}
 * are only those entities that were part of the reconstructor's input, so
 * this forest is usually a pruned view of the indexed tree.
 */
@Accessors(fluent = true)
public final class HierarchyNode {
	@Getter private final TreeEntity entity;
	private final List<HierarchyNode> children = new ArrayList<>();

	HierarchyNode(TreeEntity entity) {
		this.entity = entity;
	}

	void addChild(HierarchyNode child) {
		children.add(child);
	}

	public List<HierarchyNode> children() {
		return unmodifiableList(children);
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	public String key() {
		return entity.key();
	}

	public Object value() {
		return entity.value();
	}

	public String pos() {
		return entity.pos();
	}

	@Override
	public String toString() {
		if (children.isEmpty()) {
			return entity.key();
		} else {
			return entity.key() + children;
		}
	}
}
