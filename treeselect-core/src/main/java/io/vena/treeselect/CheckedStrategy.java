package io.vena.treeselect;

/**
 * Which checked nodes {@link SelectionFormatter} reports when hierarchy
 * conduction is on.
 */
public enum CheckedStrategy {
	/**
	 * Every checked value, as given.
	 */
	SHOW_ALL,

	/**
	 * Only the topmost checked node of each checked subtree.
	 */
	SHOW_PARENT,

	/**
	 * Only the checked nodes with no checked children.
	 */
	SHOW_CHILD,
}
