package io.vena.treeselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.pcollections.OrderedPSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.stream.Collectors.toList;

/**
 * Propagates checked state through an {@link EntityIndex}.
 *
 * <p>
 * Checking a node checks everything beneath it. Going upward, an ancestor
 * becomes checked only when all of its children are checked; otherwise it is
 * half-checked, and so is every ancestor above it on that walk.
 *
 * <p>
 * Seed keys are processed in order and share their output sets, so a later
 * seed's upward walk sees everything checked by earlier seeds.
 * Each seed is conducted downward before it is conducted upward.
 *
 * <p>
 * Stateless; one instance can be shared.
 */
public final class CheckConductor {

	public ConductionResult conduct(EntityIndex index, Collection<String> checkedKeys) {
		if (checkedKeys == null || checkedKeys.isEmpty()) {
			return ConductionResult.empty();
		}
		Set<String> checked = new LinkedHashSet<>();
		Set<String> halfChecked = new LinkedHashSet<>();
		List<String> missing = new ArrayList<>();

		for (String key: checkedKeys) {
			TreeEntity entity = (key == null)? null : index.forKey(key);
			if (entity == null) {
				LOGGER.warn("{} does not exist in the table tree.", key);
				missing.add(key);
				continue;
			}
			checked.add(key);
			for (TreeEntity child: index.childrenOf(entity)) {
				conductDown(index, child, checked);
			}
			TreeEntity parent = index.parentOf(entity);
			if (parent != null) {
				conductUp(index, parent, checked, halfChecked);
			}
		}

		halfChecked.removeAll(checked);
		LOGGER.debug("Conducted {} seeds: {} checked, {} half checked", checkedKeys.size(), checked.size(), halfChecked.size());
		return new ConductionResult(
			OrderedPSet.from(checked),
			OrderedPSet.from(halfChecked),
			List.copyOf(missing));
	}

	/**
	 * Stops at anything already checked: a checked node's whole subtree is
	 * already checked.
	 */
	private static void conductDown(EntityIndex index, TreeEntity start, Set<String> checked) {
		Deque<TreeEntity> stack = new ArrayDeque<>();
		stack.push(start);
		while (!stack.isEmpty()) {
			TreeEntity entity = stack.pop();
			if (checked.add(entity.key())) {
				List<TreeEntity> children = index.childrenOf(entity);
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(children.get(i));
				}
			}
		}
	}

	private static void conductUp(EntityIndex index, TreeEntity start, Set<String> checked, Set<String> halfChecked) {
		boolean arrivedHalfChecked = false;
		for (TreeEntity entity = start; entity != null; entity = index.parentOf(entity)) {
			if (checked.contains(entity.key())) {
				return;
			}
			boolean allChildrenChecked = !arrivedHalfChecked && index.childrenOf(entity).stream()
				.allMatch(child -> checked.contains(child.key()));
			if (allChildrenChecked) {
				checked.add(entity.key());
			} else {
				halfChecked.add(entity.key());
			}
			arrivedHalfChecked = !allChildrenChecked;
		}
	}

	/**
	 * Removes <code>uncheckedKey</code> from an already-conducted checked list,
	 * together with every ancestor and every descendant of it that appears
	 * in the list.
	 *
	 * <p>
	 * Ancestors are removed walking upward only while each next parent is
	 * still in the list. Half-checked state is not computed here; run
	 * {@link #conduct} on the result for that.
	 *
	 * @return the remaining keys, in their original order
	 */
	public List<String> uncheck(Collection<String> checkedKeys, String uncheckedKey, EntityIndex index) {
		Set<String> present = new LinkedHashSet<>(checkedKeys);
		Set<String> removed = new LinkedHashSet<>();
		removed.add(uncheckedKey);

		TreeEntity entity = index.forKey(uncheckedKey);
		if (entity == null) {
			LOGGER.warn("{} does not exist in the table tree.", uncheckedKey);
		} else {
			for (TreeEntity parent = index.parentOf(entity);
				 parent != null && present.contains(parent.key());
				 parent = index.parentOf(parent)) {
				removed.add(parent.key());
			}
			for (TreeEntity descendant: index.descendantsOf(entity)) {
				removed.add(descendant.key());
			}
		}

		return checkedKeys.stream()
			.filter(key -> !removed.contains(key))
			.collect(toList());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CheckConductor.class);
}
