package io.vena.treeselect;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Column names for {@link SimpleTreeData}: which field of a row is its id,
 * which holds its parent's id, and what parent id marks a top-level row.
 */
@Value
@Builder(toBuilder = true)
public class SimpleModeConfig {
	@Default String id = "id";
	@Default String pId = "pId";
	@Default @Nullable Object rootPId = null;

	public static SimpleModeConfig defaults() {
		return DEFAULTS;
	}

	private static final SimpleModeConfig DEFAULTS = SimpleModeConfig.builder().build();
}
