package io.vena.treeselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes a raw tree down to the nodes that match a search, plus their ancestors.
 *
 * <p>
 * A node survives if it matches, or if any of its descendants does. A
 * surviving node keeps only its surviving children, even when it matched
 * on its own.
 */
@RequiredArgsConstructor
public final class TreeFilter {
	private final EntityIndexer indexer;

	public TreeFilter() {
		this(new EntityIndexer());
	}

	/**
	 * @return null if <code>searchValue</code> is null or empty, meaning "no filter".
	 * Otherwise, the pruned tree, which may be empty.
	 */
	public @Nullable List<RawNode> filter(List<RawNode> data, @Nullable String searchValue, BiPredicate<String, RawNode> filterFunc) {
		if (searchValue == null || searchValue.isEmpty()) {
			return null;
		}
		List<RawNode> result = new ArrayList<>();
		if (data != null) {
			for (RawNode row: data) {
				RawNode filtered = prune(row, searchValue, filterFunc);
				if (filtered != null) {
					result.add(filtered);
				}
			}
		}
		LOGGER.debug("Search \"{}\" kept {} of {} top-level rows", searchValue, result.size(), (data == null)? 0 : data.size());

		// The re-index only matters for its side effects, like the label deprecation warning
		return indexer.index(result).data();
	}

	/**
	 * Post-order walk with an explicit stack, since a node's fate depends on its children's.
	 */
	private static @Nullable RawNode prune(@Nullable RawNode root, String searchValue, BiPredicate<String, RawNode> filterFunc) {
		if (root == null) {
			return null;
		}
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root));
		RawNode finished = null;
		boolean finishedSurvived = false;
		while (!stack.isEmpty()) {
			Frame top = stack.peek();
			if (finished != null) {
				// Returning from a child
				if (finishedSurvived) {
					top.survivingChildren.add(finished);
				}
				finished = null;
				finishedSurvived = false;
			}
			List<RawNode> children = top.node.children();
			while (top.nextChild < children.size() && children.get(top.nextChild) == null) {
				top.nextChild++;
			}
			if (top.nextChild < children.size()) {
				stack.push(new Frame(children.get(top.nextChild++)));
			} else {
				stack.pop();
				boolean match = filterFunc.test(searchValue, top.node);
				finishedSurvived = match || !top.survivingChildren.isEmpty();
				finished = finishedSurvived? top.node.withChildren(top.survivingChildren) : top.node;
			}
		}
		return finishedSurvived? finished : null;
	}

	/**
	 * Case-insensitive substring match on the node's title, falling back to its deprecated label.
	 */
	@SuppressWarnings("deprecation")
	public static BiPredicate<String, RawNode> titleContains() {
		return (search, node) -> {
			String title = (node.title() != null)? node.title() : node.label();
			return title != null && title.toLowerCase(Locale.ROOT).contains(search.toLowerCase(Locale.ROOT));
		};
	}

	private static final class Frame {
		final RawNode node;
		final List<RawNode> survivingChildren = new ArrayList<>();
		int nextChild = 0;

		Frame(RawNode node) {
			this.node = node;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeFilter.class);
}
