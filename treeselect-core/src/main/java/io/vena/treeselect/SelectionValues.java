package io.vena.treeselect;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Collections.singletonList;

/**
 * Converts a selector's externally supplied value into the
 * {@link WrappedValue} list that the rest of this package works with.
 */
public final class SelectionValues {
	private SelectionValues() { }

	/**
	 * Strictly checkable rows always carry their labels in the value,
	 * because there's no hierarchy from which to derive them.
	 */
	public static boolean isLabelInValue(SelectorConfig config) {
		if (config.isRowCheckable() && config.isRowCheckStrictly()) {
			return true;
		}
		return config.isLabelInValue();
	}

	/**
	 * @param value null, a single value, a {@link Collection}, or an array
	 * @return one {@link WrappedValue} per element. In label-in-value mode,
	 * an element that is neither a {@link WrappedValue} nor a {@link Map} with
	 * a <code>value</code> entry becomes a null value with an empty label.
	 */
	public static List<WrappedValue> wrap(Object value, SelectorConfig config) {
		List<?> values = toList(value);
		if (isLabelInValue(config)) {
			return values.stream()
				.map(SelectionValues::labelledValue)
				.collect(Collectors.toList());
		} else {
			return values.stream()
				.map(WrappedValue::of)
				.collect(Collectors.toList());
		}
	}

	/**
	 * @return <code>value</code> as a list: empty for null or the empty string,
	 * the elements of a collection or array, or a one-element list otherwise.
	 */
	public static List<?> toList(Object value) {
		if (value == null || "".equals(value)) {
			return new ArrayList<>();
		} else if (value instanceof Collection) {
			return new ArrayList<>((Collection<?>) value);
		} else if (value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> result = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				result.add(Array.get(value, i));
			}
			return result;
		} else {
			return singletonList(value);
		}
	}

	private static WrappedValue labelledValue(Object element) {
		if (element instanceof WrappedValue) {
			return (WrappedValue) element;
		} else if (element instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) element;
			Object label = map.get("label");
			return WrappedValue.of(map.get("value"), (label == null)? null : label.toString());
		} else {
			return EMPTY_LABELLED_VALUE;
		}
	}

	private static final WrappedValue EMPTY_LABELLED_VALUE = WrappedValue.of(null, "");
}
