package io.vena.treeselect;

import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * A selected value, with the label the caller supplied for it, if any.
 */
@Value
@Accessors(fluent = true)
public class WrappedValue {
	@Nullable Object value;
	@Nullable String label;

	public static WrappedValue of(@Nullable Object value) {
		return new WrappedValue(value, null);
	}

	public static WrappedValue of(@Nullable Object value, @Nullable String label) {
		return new WrappedValue(value, label);
	}

	public boolean hasLabel() {
		return label != null && !label.isEmpty();
	}
}
