package works.phijson.jackson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.module.SimpleDeserializers;
import tools.jackson.databind.module.SimpleSerializers;
import works.phijson.CanonicalValue;
import works.phijson.CanonicalValue.Bool;
import works.phijson.CanonicalValue.Float64;
import works.phijson.CanonicalValue.Int;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Null;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.CanonicalValue.Text;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.PROPERTY_NAME;

/**
 * Teaches a Jackson mapper to write and read {@link CanonicalValue} trees.
 * <p>
 * Ints are written as JSON integers and floats always with a fraction or exponent,
 * so each reads back as the kind it was.
 * Reading rejects duplicate keys, integers beyond 64 bits, and floats that overflow.
 */
public final class CanonicalValueModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		SimpleSerializers serializers = new SimpleSerializers();
		serializers.addSerializer(CanonicalValue.class, new CanonicalValueSerializer());
		context.addSerializers(serializers);

		SimpleDeserializers deserializers = new SimpleDeserializers();
		deserializers.addDeserializer(CanonicalValue.class, new CanonicalValueDeserializer());
		context.addDeserializers(deserializers);
	}

	private static final class CanonicalValueSerializer extends ValueSerializer<CanonicalValue> {
		@Override
		public void serialize(CanonicalValue value, JsonGenerator gen, SerializationContext serializers) {
			write(value, gen);
		}

		private static void write(CanonicalValue value, JsonGenerator gen) {
			if (value instanceof Null) {
				gen.writeNull();
			} else if (value instanceof Bool b) {
				gen.writeBoolean(b.value());
			} else if (value instanceof Int i) {
				gen.writeNumber(i.value());
			} else if (value instanceof Float64 f) {
				gen.writeNumber(f.value());
			} else if (value instanceof Text t) {
				gen.writeString(t.value());
			} else if (value instanceof Sequence s) {
				gen.writeStartArray();
				for (CanonicalValue element : s.elements()) {
					write(element, gen);
				}
				gen.writeEndArray();
			} else if (value instanceof Mapping m) {
				gen.writeStartObject();
				for (Map.Entry<String, CanonicalValue> entry : m.entries().entrySet()) {
					gen.writeName(entry.getKey());
					write(entry.getValue(), gen);
				}
				gen.writeEndObject();
			} else {
				throw new IllegalStateException("Unexpected value: " + value);
			}
		}
	}

	private static final class CanonicalValueDeserializer extends ValueDeserializer<CanonicalValue> {
		@Override
		public boolean isCachable() {
			return true;
		}

		@Override
		public CanonicalValue deserialize(JsonParser p, DeserializationContext ctxt) {
			return read(p);
		}

		/**
		 * Reads the value whose first token is the parser's current token,
		 * leaving the parser on the value's last token.
		 */
		private static CanonicalValue read(JsonParser p) {
			JsonToken token = p.currentToken();
			if (token == null) {
				throw new StreamReadException(p, "Unexpected end of input");
			}
			switch (token) {
				case VALUE_NULL:
					return CanonicalValue.NULL;
				case VALUE_TRUE:
					return CanonicalValue.TRUE;
				case VALUE_FALSE:
					return CanonicalValue.FALSE;
				case VALUE_NUMBER_INT:
					if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
						throw new StreamReadException(p, "Integer out of 64-bit range: " + p.getString());
					}
					return CanonicalValue.of(p.getLongValue());
				case VALUE_NUMBER_FLOAT: {
					double value = p.getDoubleValue();
					if (!Double.isFinite(value)) {
						throw new StreamReadException(p, "Float out of 64-bit range: " + p.getString());
					}
					return CanonicalValue.of(value);
				}
				case VALUE_STRING:
					return CanonicalValue.of(p.getString());
				case START_ARRAY:
					return readSequence(p);
				case START_OBJECT:
					return readMapping(p);
				default:
					throw new StreamReadException(p, "Unexpected token " + token);
			}
		}

		private static Sequence readSequence(JsonParser p) {
			List<CanonicalValue> elements = new ArrayList<>();
			while (p.nextToken() != END_ARRAY) {
				elements.add(read(p));
			}
			return new Sequence(elements);
		}

		private static Mapping readMapping(JsonParser p) {
			Map<String, CanonicalValue> entries = new LinkedHashMap<>();
			for (JsonToken token = p.nextToken(); token != END_OBJECT; token = p.nextToken()) {
				if (token != PROPERTY_NAME) {
					throw new StreamReadException(p, "Expected " + PROPERTY_NAME + "; found " + token);
				}
				String name = p.currentName();
				if (entries.containsKey(name)) {
					throw new StreamReadException(p, "Duplicate key \"" + name + "\"");
				}
				p.nextToken();
				entries.put(name, read(p));
			}
			return new Mapping(entries);
		}
	}
}
