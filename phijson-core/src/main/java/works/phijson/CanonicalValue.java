package works.phijson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.phijson.exceptions.MalformedDocumentException;

import static java.util.Objects.requireNonNull;

/**
 * The closed set of value shapes a document can express.
 * <p>
 * Values form trees: a {@link Sequence} or {@link Mapping} holds an
 * unmodifiable copy of its children, so no value can contain itself.
 * Equality is structural; {@link Mapping} equality ignores key order,
 * though the order is kept for output.
 */
public sealed interface CanonicalValue permits
	CanonicalValue.Null,
	CanonicalValue.Bool,
	CanonicalValue.Int,
	CanonicalValue.Float64,
	CanonicalValue.Text,
	CanonicalValue.Sequence,
	CanonicalValue.Mapping
{
	Kind kind();

	/**
	 * In {@link CanonicalOrdering canonical order}.
	 */
	enum Kind {
		NULL,
		BOOL,
		INT,
		FLOAT,
		TEXT,
		SEQUENCE,
		MAPPING
	}

	Null NULL = new Null();
	Bool TRUE = new Bool(true);
	Bool FALSE = new Bool(false);

	static Bool of(boolean value) {
		return value ? TRUE : FALSE;
	}

	static Int of(long value) {
		return new Int(value);
	}

	static Float64 of(double value) {
		return new Float64(value);
	}

	static Text of(String value) {
		return new Text(value);
	}

	record Null() implements CanonicalValue {
		@Override
		public Kind kind() {
			return Kind.NULL;
		}

		@Override
		public String toString() {
			return "null";
		}
	}

	record Bool(boolean value) implements CanonicalValue {
		@Override
		public Kind kind() {
			return Kind.BOOL;
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}

	record Int(long value) implements CanonicalValue {
		@Override
		public Kind kind() {
			return Kind.INT;
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	/**
	 * Always finite. Non-finite doubles are represented by
	 * {@link FloatSentinels sentinel text values} instead.
	 */
	record Float64(double value) implements CanonicalValue {
		public Float64 {
			if (!Double.isFinite(value)) {
				throw new IllegalArgumentException("Float64 must be finite; use FloatSentinels for " + value);
			}
		}

		@Override
		public Kind kind() {
			return Kind.FLOAT;
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	record Text(String value) implements CanonicalValue {
		public Text {
			requireNonNull(value);
		}

		@Override
		public Kind kind() {
			return Kind.TEXT;
		}

		@Override
		public String toString() {
			return '"' + value + '"';
		}
	}

	record Sequence(List<CanonicalValue> elements) implements CanonicalValue {
		public Sequence {
			elements = List.copyOf(elements);
		}

		public static Sequence of(CanonicalValue... elements) {
			return new Sequence(List.of(elements));
		}

		public int size() {
			return elements.size();
		}

		public CanonicalValue get(int index) {
			return elements.get(index);
		}

		@Override
		public Kind kind() {
			return Kind.SEQUENCE;
		}

		@Override
		public String toString() {
			return elements.toString();
		}
	}

	/**
	 * Keys are unique and keep the order in which they were supplied.
	 */
	record Mapping(Map<String, CanonicalValue> entries) implements CanonicalValue {
		public Mapping {
			LinkedHashMap<String, CanonicalValue> copy = new LinkedHashMap<>();
			entries.forEach((k, v) -> copy.put(requireNonNull(k), requireNonNull(v, () -> "Value for key \"" + k + "\"")));
			entries = Collections.unmodifiableMap(copy);
		}

		public static Mapping empty() {
			return new Mapping(Map.of());
		}

		public boolean has(String key) {
			return entries.containsKey(key);
		}

		public Optional<CanonicalValue> get(String key) {
			return Optional.ofNullable(entries.get(key));
		}

		public List<String> keys() {
			return new ArrayList<>(entries.keySet());
		}

		public int size() {
			return entries.size();
		}

		/**
		 * @return the {@link ReservedNames#TYPE type tag} of this mapping if it has one
		 * and it is text; {@link Optional#empty()} if it has none
		 * @throws MalformedDocumentException if the tag is not text
		 */
		public Optional<String> typeTag() {
			CanonicalValue tag = entries.get(ReservedNames.TYPE);
			if (tag == null) {
				return Optional.empty();
			} else if (tag instanceof Text t) {
				return Optional.of(t.value());
			} else {
				throw new MalformedDocumentException("\"" + ReservedNames.TYPE + "\" must be text; found " + tag.kind());
			}
		}

		/**
		 * @return a copy of this mapping with {@code key} removed, order otherwise unchanged
		 */
		public Mapping without(String key) {
			LinkedHashMap<String, CanonicalValue> copy = new LinkedHashMap<>(entries);
			copy.remove(key);
			return new Mapping(copy);
		}

		@Override
		public Kind kind() {
			return Kind.MAPPING;
		}

		@Override
		public String toString() {
			return entries.toString();
		}
	}
}
