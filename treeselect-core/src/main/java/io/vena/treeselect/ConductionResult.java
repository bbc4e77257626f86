package io.vena.treeselect;

import java.util.List;
import lombok.Value;
import lombok.experimental.Accessors;
import org.pcollections.OrderedPSet;

/**
 * Output of {@link CheckConductor#conduct}.
 *
 * <p>
 * A key is never in both {@link #checkedKeys} and {@link #halfCheckedKeys}.
 * {@link #missingKeys} lists seed keys that were not in the index, in the
 * order they were encountered.
 */
@Value
@Accessors(fluent = true)
public class ConductionResult {
	OrderedPSet<String> checkedKeys;
	OrderedPSet<String> halfCheckedKeys;
	List<String> missingKeys;

	public static ConductionResult empty() {
		return EMPTY;
	}

	public boolean isChecked(String key) {
		return checkedKeys.contains(key);
	}

	public boolean isHalfChecked(String key) {
		return halfCheckedKeys.contains(key);
	}

	public CheckState stateOf(String key) {
		if (checkedKeys.contains(key)) {
			return CheckState.CHECKED;
		} else if (halfCheckedKeys.contains(key)) {
			return CheckState.HALF_CHECKED;
		} else {
			return CheckState.UNCHECKED;
		}
	}

	private static final ConductionResult EMPTY = new ConductionResult(OrderedPSet.empty(), OrderedPSet.empty(), List.of());
}
