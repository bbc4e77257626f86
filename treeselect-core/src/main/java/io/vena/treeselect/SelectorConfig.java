package io.vena.treeselect;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

import static io.vena.treeselect.CheckedStrategy.SHOW_CHILD;

/**
 * The settings of a tree selector that affect how its value is reported.
 */
@Value
@Builder(toBuilder = true)
public class SelectorConfig {
	/**
	 * Whether rows have check boxes at all.
	 */
	@Default boolean rowCheckable = false;

	/**
	 * When set, checking a row affects only that row: no conduction up or down.
	 */
	@Default boolean rowCheckStrictly = false;

	@Default boolean labelInValue = false;
	@Default CheckedStrategy showCheckedStrategy = SHOW_CHILD;

	/**
	 * Name of the {@link RawNode#property property} used as a value's label.
	 */
	@Default String rowLabelProp = "title";

	public static SelectorConfig defaults() {
		return DEFAULTS;
	}

	/**
	 * Whether checked state conducts through the hierarchy.
	 */
	public boolean isConducting() {
		return rowCheckable && !rowCheckStrictly;
	}

	private static final SelectorConfig DEFAULTS = SelectorConfig.builder().build();
}
