package io.vena.treeselect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Comparator.comparingInt;

/**
 * Rebuilds the smallest forest connecting a flat list of entities.
 *
 * <p>
 * An entity becomes a child of another only if its parent position belongs
 * to an entity in the same input list. Anything else becomes a root.
 * Entities are attached shallowest first, and the sort is stable, so siblings
 * keep their input order.
 */
public final class HierarchyReconstructor {

	/**
	 * @param entities may contain nulls, which are ignored.
	 * @return the roots, ordered by depth and then by input order.
	 */
	public List<HierarchyNode> reconstruct(Collection<TreeEntity> entities) {
		if (entities == null || entities.isEmpty()) {
			return new ArrayList<>();
		}

		List<Parsed> parsed = new ArrayList<>(entities.size());
		Map<String, HierarchyNode> nodesByPos = new LinkedHashMap<>();
		for (TreeEntity entity: entities) {
			if (entity != null) {
				HierarchyNode node = new HierarchyNode(entity);
				String pos = entity.pos();
				parsed.add(new Parsed(node, pos, Position.depthOf(pos)));
				nodesByPos.put(pos, node);
			}
		}
		parsed.sort(comparingInt(Parsed::depth));

		Map<String, HierarchyNode> roots = new LinkedHashMap<>();
		for (Parsed p: parsed) {
			String parentPos = Position.parentText(p.pos());
			HierarchyNode parent = (parentPos == null)? null : nodesByPos.get(parentPos);
			if (parent == null) {
				roots.put(p.pos(), p.node());
			} else {
				parent.addChild(p.node());
			}
		}
		LOGGER.debug("Reconstructed {} roots from {} entities", roots.size(), parsed.size());
		return new ArrayList<>(roots.values());
	}

	/**
	 * @return the nodes with no children in the given forest, in pre-order.
	 */
	public static List<HierarchyNode> leaves(List<HierarchyNode> roots) {
		List<HierarchyNode> result = new ArrayList<>();
		Deque<HierarchyNode> stack = new ArrayDeque<>();
		for (int i = roots.size() - 1; i >= 0; i--) {
			stack.push(roots.get(i));
		}
		while (!stack.isEmpty()) {
			HierarchyNode node = stack.pop();
			List<HierarchyNode> children = node.children();
			if (children.isEmpty()) {
				result.add(node);
			} else {
				for (int i = children.size() - 1; i >= 0; i--) {
					stack.push(children.get(i));
				}
			}
		}
		return result;
	}

	private record Parsed(HierarchyNode node, String pos, int depth) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyReconstructor.class);
}
