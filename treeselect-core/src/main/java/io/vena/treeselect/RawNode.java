package io.vena.treeselect;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * One node of the caller's tree, before indexing.
 *
 * <p>
 * Every field is optional. {@link EntityIndexer} derives a usable key even
 * when both {@link #key} and {@link #value} are missing. Properties that have
 * no dedicated field go in {@link #attributes} and can still be used as a
 * label property via {@link #property}.
 */
@Value
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class RawNode {
	@Nullable String key;
	@Nullable String title;

	/**
	 * @deprecated use {@link #title}. Still honoured, but the first use logs a warning.
	 */
	@Deprecated
	@Nullable String label;

	@Nullable Object value;
	@Singular Map<String, Object> attributes;
	@Singular List<RawNode> children;

	/**
	 * Looks up a property by name, the way a label property is resolved.
	 * The dedicated fields take precedence over {@link #attributes}.
	 */
	@SuppressWarnings("deprecation")
	public @Nullable Object property(@Nullable String name) {
		if (name == null) {
			return null;
		}
		switch (name) {
			case "key": return key;
			case "title": return title;
			case "label": return label;
			case "value": return value;
			case "children": return children;
			default: return attributes.get(name);
		}
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	public RawNode withChildren(List<RawNode> newChildren) {
		return toBuilder().clearChildren().children(newChildren).build();
	}

	public static RawNode of(Object value, RawNode... children) {
		return RawNode.builder()
			.value(value)
			.title(value == null ? null : value.toString())
			.children(List.of(children))
			.build();
	}
}
