package io.vena.treeselect;

import java.util.List;
import org.junit.jupiter.api.Test;

import static io.vena.treeselect.CheckedStrategy.SHOW_CHILD;
import static io.vena.treeselect.CheckedStrategy.SHOW_PARENT;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeSelectTest extends AbstractTreeSelectTest {

	@Test
	void checkThenFormat() {
		EntityIndex index = treeSelect.indexTree(sampleTree());
		ConductionResult state = treeSelect.conductCheck(index, List.of("D", "E"));
		List<WrappedValue> checked = state.checkedKeys().stream()
			.map(index::forKey)
			.map(e -> WrappedValue.of(e.value()))
			.collect(toList());

		SelectorConfig config = SelectorConfig.builder().rowCheckable(true).showCheckedStrategy(SHOW_PARENT).build();
		assertEquals(List.of(SelectionValue.of("Node B", "B")), treeSelect.formatSelection(checked, config, index));

		SelectorConfig childConfig = config.toBuilder().showCheckedStrategy(SHOW_CHILD).build();
		assertEquals(List.of("D", "E"),
			treeSelect.formatSelection(checked, childConfig, index).stream().map(SelectionValue::value).collect(toList()));
	}

	@Test
	void uncheckThenReconduct() {
		EntityIndex index = treeSelect.indexTree(sampleTree());
		ConductionResult all = treeSelect.conductCheck(index, List.of("A"));
		List<String> remaining = treeSelect.conductUncheck(all.checkedKeys(), "E", index);
		assertEquals(List.of("D", "C"), remaining);

		ConductionResult after = treeSelect.conductCheck(index, remaining);
		assertThat(after.checkedKeys(), containsInAnyOrder("D", "C"));
		assertThat(after.halfCheckedKeys(), containsInAnyOrder("B", "A"));
	}

	@Test
	void searchThenIndex() {
		List<RawNode> filtered = treeSelect.filterTree(forest(), "Q12");
		EntityIndex index = treeSelect.indexTree(filtered);
		assertEquals(List.of("Q", "Q1", "Q12"), index.entities().stream().map(TreeEntity::key).collect(toList()));
		assertEquals("0-0-0-0", index.forKey("Q12").pos(), "Positions are recomputed for the pruned tree");
	}

	@Test
	void reconstructHierarchy() {
		EntityIndex index = treeSelect.indexTree(sampleTree());
		List<HierarchyNode> roots = treeSelect.reconstructHierarchy(List.of(index.forKey("E"), index.forKey("B")));
		assertEquals("[B[E]]", roots.toString());
	}

	@Test
	void positionRelation() {
		assertTrue(treeSelect.isPositionRelated("1-2", "1-2-3"));
		assertTrue(treeSelect.isPositionRelated("1-3-2", "1"));
		assertFalse(treeSelect.isPositionRelated("1-2", "1-21"));
	}

	@Test
	void wrapValues() {
		assertEquals(List.of(WrappedValue.of("x")), treeSelect.wrapValues("x", SelectorConfig.defaults()));
	}

	@Test
	void ariaIds_countUpAndReset() {
		assertEquals("tree_1", treeSelect.generateAriaId("tree"));
		assertEquals("tree_2", treeSelect.generateAriaId("tree"));
		assertEquals("other_3", treeSelect.generateAriaId("other"));
		treeSelect.resetAriaId();
		assertEquals("tree_1", treeSelect.generateAriaId("tree"));
	}

	@Test
	void contexts_areIndependent() {
		TreeSelect other = new TreeSelect(new TreeSelectContext());
		treeSelect.generateAriaId("a");
		treeSelect.generateAriaId("a");
		assertEquals("a_1", other.generateAriaId("a"));
		assertSame(context, treeSelect.context());
	}

	@Test
	void defaultConstructor_usesGlobalContext() {
		assertSame(TreeSelectContext.global(), new TreeSelect().context());
	}
}
