package io.vena.treeselect;

import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * One entry of the value list reported to the caller.
 */
@Value
@Accessors(fluent = true)
public class SelectionValue {
	@Nullable String label;
	@Nullable Object value;

	public static SelectionValue of(@Nullable String label, @Nullable Object value) {
		return new SelectionValue(label, value);
	}
}
