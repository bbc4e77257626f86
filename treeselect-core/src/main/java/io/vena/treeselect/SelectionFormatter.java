package io.vena.treeselect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.stream.Collectors.toList;

/**
 * Turns the list of checked values into the list reported to the caller.
 *
 * <p>
 * When checking conducts through the hierarchy ({@link SelectorConfig#isConducting()}),
 * the checked values are regrouped with {@link HierarchyReconstructor} and
 * reported according to {@link SelectorConfig#getShowCheckedStrategy()}.
 * Only values present in the input are grouped: no conduction happens here.
 * Otherwise, every value is reported as given.
 */
@RequiredArgsConstructor
public final class SelectionFormatter {
	private final HierarchyReconstructor reconstructor;

	public SelectionFormatter() {
		this(new HierarchyReconstructor());
	}

	public List<SelectionValue> format(List<WrappedValue> values, SelectorConfig config, EntityIndex index) {
		String labelProp = config.getRowLabelProp();
		CheckedStrategy strategy = config.getShowCheckedStrategy();
		// A null strategy reports everything, like SHOW_ALL
		if (!config.isConducting() || strategy == null || strategy == CheckedStrategy.SHOW_ALL) {
			return values.stream()
				.map(v -> SelectionValue.of(label(v, index.forValue(v.value()), labelProp), v.value()))
				.collect(toList());
		}

		Map<Object, WrappedValue> wrappedByValue = new LinkedHashMap<>();
		List<TreeEntity> entities = new ArrayList<>();
		List<WrappedValue> unplaced = new ArrayList<>();
		for (WrappedValue v: values) {
			wrappedByValue.put(v.value(), v);
			TreeEntity entity = index.forValue(v.value());
			if (entity == null) {
				unplaced.add(v);
			} else {
				entities.add(entity);
			}
		}
		if (!unplaced.isEmpty()) {
			LOGGER.debug("{} values have no entity and will be reported as given", unplaced.size());
		}

		List<HierarchyNode> roots = reconstructor.reconstruct(entities);
		List<HierarchyNode> reported;
		switch (strategy) {
			case SHOW_PARENT:
				reported = roots;
				break;
			case SHOW_CHILD:
				reported = HierarchyReconstructor.leaves(roots);
				break;
			default:
				throw new AssertionError("Unexpected strategy: " + strategy);
		}

		List<SelectionValue> result = new ArrayList<>(reported.size() + unplaced.size());
		for (HierarchyNode node: reported) {
			Object value = node.value();
			result.add(SelectionValue.of(label(wrappedByValue.get(value), node.entity(), labelProp), value));
		}
		for (WrappedValue v: unplaced) {
			result.add(SelectionValue.of(label(v, null, labelProp), v.value()));
		}
		return result;
	}

	/**
	 * The first of these that is available:
	 *
	 * <ol>
	 *     <li>the label on <code>wrappedValue</code>;</li>
	 *     <li>the <code>labelProp</code> property of the entity: read off the
	 *     entity's value if that is a {@link Map}, and off its {@link RawNode} otherwise.
	 *     Skipped when <code>labelProp</code> is null;</li>
	 *     <li>the text of the value itself.</li>
	 * </ol>
	 */
	public static @Nullable String label(@Nullable WrappedValue wrappedValue, @Nullable TreeEntity entity, @Nullable String labelProp) {
		if (wrappedValue != null && wrappedValue.hasLabel()) {
			return wrappedValue.label();
		}
		if (entity != null && labelProp != null) {
			Object fromEntity;
			if (entity.value() instanceof Map) {
				fromEntity = ((Map<?, ?>) entity.value()).get(labelProp);
			} else {
				fromEntity = entity.node().property(labelProp);
			}
			if (fromEntity != null) {
				return fromEntity.toString();
			}
		}
		Object value = (wrappedValue != null)? wrappedValue.value() : (entity != null)? entity.value() : null;
		return (value == null)? null : value.toString();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SelectionFormatter.class);
}
