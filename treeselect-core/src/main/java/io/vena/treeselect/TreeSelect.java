package io.vena.treeselect;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point bundling the index, conduction and formatting operations
 * around a single {@link TreeSelectContext}.
 *
 * <p>
 * Every operation is a synchronous transformation of its arguments. None of
 * them throws for unknown keys, missing identities, or deprecated fields:
 * those are logged and a best-effort result is returned.
 *
 * <p>
 * Typical round trip:
 *
 * <pre>
 * TreeSelect treeSelect = new TreeSelect();
 * EntityIndex index = treeSelect.indexTree(nodes);
 * ConductionResult state = treeSelect.conductCheck(index, checkedKeys);
 * List&lt;SelectionValue&gt; shown = treeSelect.formatSelection(values, config, index);
 * </pre>
 */
@Accessors(fluent = true)
public final class TreeSelect {
	@Getter private final TreeSelectContext context;
	private final EntityIndexer indexer;
	private final HierarchyReconstructor reconstructor;
	private final CheckConductor conductor;
	private final SelectionFormatter formatter;
	private final TreeFilter filter;

	public TreeSelect() {
		this(TreeSelectContext.global());
	}

	public TreeSelect(TreeSelectContext context) {
		this.context = context;
		this.indexer = new EntityIndexer(context);
		this.reconstructor = new HierarchyReconstructor();
		this.conductor = new CheckConductor();
		this.formatter = new SelectionFormatter(reconstructor);
		this.filter = new TreeFilter(indexer);
	}

	public EntityIndex indexTree(List<RawNode> rawTree) {
		return indexer.index(rawTree);
	}

	public List<HierarchyNode> reconstructHierarchy(Collection<TreeEntity> flatEntities) {
		return reconstructor.reconstruct(flatEntities);
	}

	public ConductionResult conductCheck(EntityIndex index, Collection<String> checkedKeys) {
		return conductor.conduct(index, checkedKeys);
	}

	public List<String> conductUncheck(Collection<String> checkedKeys, String removedKey, EntityIndex index) {
		return conductor.uncheck(checkedKeys, removedKey, index);
	}

	public List<SelectionValue> formatSelection(List<WrappedValue> values, SelectorConfig config, EntityIndex index) {
		return formatter.format(values, config, index);
	}

	public boolean isPositionRelated(String posA, String posB) {
		return Position.isRelated(posA, posB);
	}

	public @Nullable List<RawNode> filterTree(List<RawNode> rawTree, @Nullable String searchValue, BiPredicate<String, RawNode> filterFunc) {
		return filter.filter(rawTree, searchValue, filterFunc);
	}

	public @Nullable List<RawNode> filterTree(List<RawNode> rawTree, @Nullable String searchValue) {
		return filterTree(rawTree, searchValue, TreeFilter.titleContains());
	}

	public List<RawNode> parseSimpleTreeData(List<? extends Map<String, ?>> rows, SimpleModeConfig config) {
		return SimpleTreeData.parse(rows, config);
	}

	public List<WrappedValue> wrapValues(Object value, SelectorConfig config) {
		return SelectionValues.wrap(value, config);
	}

	public String generateAriaId(String prefix) {
		return context.generateAriaId(prefix);
	}

	public void resetAriaId() {
		context.resetAriaId();
	}
}
