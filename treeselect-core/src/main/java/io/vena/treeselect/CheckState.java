package io.vena.treeselect;

public enum CheckState {
	UNCHECKED,
	HALF_CHECKED,
	CHECKED,
}
