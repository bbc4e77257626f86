package io.vena.treeselect;

import java.util.List;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * The indexed form of one {@link RawNode}.
 *
 * <p>
 * Entities live in the arena of the {@link EntityIndex} that built them and
 * refer to their relatives by {@link #handle}. Use {@link EntityIndex#parentOf}
 * and {@link EntityIndex#childrenOf} to navigate.
 *
 * <p>
 * {@link #children} is null for a node whose raw form had no children,
 * and non-empty otherwise.
 */
@Value
@Accessors(fluent = true)
public class TreeEntity {
	int handle;
	String key;
	@Nullable Object value;
	Position position;
	RawNode node;
	@Nullable Integer parent;
	@Nullable List<Integer> children;

	public boolean isRoot() {
		return parent == null;
	}

	public boolean isLeaf() {
		return children == null;
	}

	/**
	 * @return the dash-separated text form of {@link #position}, as used by
	 * {@link EntityIndex#posEntities()}.
	 */
	public String pos() {
		return position.toString();
	}

	@Override
	public String toString() {
		return "TreeEntity(" + key + "@" + position + ")";
	}
}
