package io.vena.treeselect.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.vena.treeselect.RawNode;
import io.vena.treeselect.SelectionValue;
import io.vena.treeselect.WrappedValue;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Teaches Jackson to read and write {@link RawNode} trees and the selection value types.
 *
 * <p>
 * A node is a JSON object. <code>key</code>, <code>title</code>,
 * <code>label</code>, <code>value</code> and <code>children</code> map to the
 * corresponding {@link RawNode} fields; every other field becomes an
 * attribute. <code>children</code> may be an array or a single object;
 * null array elements are kept.
 * A numeric or boolean <code>key</code> is read as text.
 */
public final class TreeSelectJacksonModule extends SimpleModule {
	public TreeSelectJacksonModule() {
		super(TreeSelectJacksonModule.class.getSimpleName());
		addDeserializer(RawNode.class, new RawNodeDeserializer());
		addSerializer(RawNode.class, new RawNodeSerializer());
		addDeserializer(WrappedValue.class, new WrappedValueDeserializer());
		addSerializer(SelectionValue.class, new SelectionValueSerializer());
	}

	static final class RawNodeDeserializer extends JsonDeserializer<RawNode> {
		@Override
		public RawNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			JsonNode tree = p.getCodec().readTree(p);
			return nodeFrom(tree, p.getCodec(), ctxt);
		}

		@SuppressWarnings("deprecation")
		private RawNode nodeFrom(JsonNode json, ObjectCodec codec, DeserializationContext ctxt) throws IOException {
			if (!json.isObject()) {
				return ctxt.reportInputMismatch(RawNode.class, "Tree node must be a JSON object, not %s", json.getNodeType());
			}
			RawNode.RawNodeBuilder builder = RawNode.builder();
			Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				JsonNode fieldValue = field.getValue();
				switch (field.getKey()) {
					case "key":
						builder.key(textOrNull(fieldValue));
						break;
					case "title":
						builder.title(textOrNull(fieldValue));
						break;
					case "label":
						builder.label(textOrNull(fieldValue));
						break;
					case "value":
						builder.value(plain(fieldValue, codec));
						break;
					case "children":
						if (fieldValue.isArray()) {
							for (JsonNode child: fieldValue) {
								builder.child(child.isNull()? null : nodeFrom(child, codec, ctxt));
							}
						} else if (fieldValue.isObject()) {
							builder.child(nodeFrom(fieldValue, codec, ctxt));
						}
						break;
					default:
						builder.attribute(field.getKey(), plain(fieldValue, codec));
				}
			}
			return builder.build();
		}
	}

	static final class RawNodeSerializer extends JsonSerializer<RawNode> {
		@Override
		@SuppressWarnings("deprecation")
		public void serialize(RawNode node, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			writeIfPresent(gen, serializers, "key", node.key());
			writeIfPresent(gen, serializers, "title", node.title());
			writeIfPresent(gen, serializers, "label", node.label());
			writeIfPresent(gen, serializers, "value", node.value());
			for (Map.Entry<String, Object> attribute: node.attributes().entrySet()) {
				gen.writeFieldName(attribute.getKey());
				serializers.defaultSerializeValue(attribute.getValue(), gen);
			}
			if (!node.children().isEmpty()) {
				gen.writeArrayFieldStart("children");
				for (RawNode child: node.children()) {
					if (child == null) {
						gen.writeNull();
					} else {
						serialize(child, gen, serializers);
					}
				}
				gen.writeEndArray();
			}
			gen.writeEndObject();
		}
	}

	/**
	 * Accepts <code>{"value": ..., "label": ...}</code> or a bare value.
	 */
	static final class WrappedValueDeserializer extends JsonDeserializer<WrappedValue> {
		@Override
		public WrappedValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
			JsonNode tree = p.getCodec().readTree(p);
			if (tree.isObject() && tree.has("value")) {
				return WrappedValue.of(plain(tree.get("value"), p.getCodec()), textOrNull(tree.get("label")));
			} else {
				return WrappedValue.of(plain(tree, p.getCodec()));
			}
		}
	}

	static final class SelectionValueSerializer extends JsonSerializer<SelectionValue> {
		@Override
		public void serialize(SelectionValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
			gen.writeStartObject();
			gen.writeFieldName("label");
			serializers.defaultSerializeValue(value.label(), gen);
			gen.writeFieldName("value");
			serializers.defaultSerializeValue(value.value(), gen);
			gen.writeEndObject();
		}
	}

	private static void writeIfPresent(JsonGenerator gen, SerializerProvider serializers, String name, Object value) throws IOException {
		if (value != null) {
			gen.writeFieldName(name);
			serializers.defaultSerializeValue(value, gen);
		}
	}

	private static String textOrNull(JsonNode json) {
		if (json == null || json.isNull() || json.isMissingNode()) {
			return null;
		} else if (json.isValueNode()) {
			return json.asText();
		} else {
			return json.toString();
		}
	}

	/**
	 * Converts to the plain Java form: maps, lists, strings, numbers, booleans.
	 */
	private static Object plain(JsonNode json, ObjectCodec codec) throws IOException {
		if (json == null || json.isNull()) {
			return null;
		}
		return codec.treeToValue(json, Object.class);
	}
}
