package works.phijson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.CanonicalValue.Text;
import works.phijson.TestTypes.Color;
import works.phijson.TestTypes.Holder;
import works.phijson.TestTypes.Point;
import works.phijson.TestTypes.Tally;
import works.phijson.array.NumericArray;
import works.phijson.exceptions.UnregisteredTypeException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.phijson.CanonicalValue.NULL;

class EncoderTest {
	Encoder encoder;

	@BeforeEach
	void setUp() {
		encoder = new Encoder(TestTypes.registry().freeze());
	}

	@Test
	void primitives_mapDirectly() {
		assertEquals(NULL, encoder.encode(null));
		assertEquals(CanonicalValue.TRUE, encoder.encode(true));
		assertEquals(CanonicalValue.of(7L), encoder.encode(7));
		assertEquals(CanonicalValue.of(7L), encoder.encode((short) 7));
		assertEquals(CanonicalValue.of(7L), encoder.encode(7L));
		assertEquals(CanonicalValue.of(0.5), encoder.encode(0.5));
		assertEquals(CanonicalValue.of(0.5), encoder.encode(0.5f));
		assertEquals(CanonicalValue.of("hello"), encoder.encode("hello"));
		assertEquals(CanonicalValue.of("GREEN"), encoder.encode(Color.GREEN));
	}

	@Test
	void nonFiniteFloats_becomeSentinels() {
		assertEquals(new Text("NaN"), encoder.encode(Double.NaN));
		assertEquals(new Text("Infinity"), encoder.encode(Double.POSITIVE_INFINITY));
		assertEquals(new Text("-Infinity"), encoder.encode(Float.NEGATIVE_INFINITY));
	}

	@Test
	void registeredObject_hasTypeFirstThenDeclaredFields() {
		Mapping encoded = (Mapping) encoder.encode(new Point(3, 4));
		assertEquals(List.of("type", "x", "y"), encoded.keys());
		assertEquals(new Text("Point"), encoded.get("type").orElseThrow());
		assertEquals(CanonicalValue.of(3L), encoded.get("x").orElseThrow());
	}

	@Test
	void set_isTaggedAndSorted() {
		Mapping encoded = (Mapping) encoder.encode(new LinkedHashSet<>(List.of("b", "c", "a")));
		assertEquals(new Text("__set__"), encoded.get("type").orElseThrow());
		assertEquals(
			Sequence.of(CanonicalValue.of("a"), CanonicalValue.of("b"), CanonicalValue.of("c")),
			encoded.get("items").orElseThrow());
	}

	@Test
	void sets_withSameElements_encodeIdentically() {
		Set<Object> forward = new LinkedHashSet<>();
		Set<Object> backward = new LinkedHashSet<>();
		List<Object> elements = List.of(new Point(2, 1), 5L, "text", new Point(1, 9), 2.5);
		elements.forEach(forward::add);
		for (int i = elements.size() - 1; i >= 0; i--) {
			backward.add(elements.get(i));
		}
		assertEquals(encoder.encode(forward), encoder.encode(backward));
		assertEquals(encoder.encode(forward).toString(), encoder.encode(backward).toString());
	}

	@Test
	void list_preservesOrder() {
		assertEquals(
			Sequence.of(CanonicalValue.of(3L), CanonicalValue.of(1L), CanonicalValue.of(2L)),
			encoder.encode(List.of(3, 1, 2)));
	}

	@Test
	void map_writesKeysSorted() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("zeta", 1);
		map.put("alpha", 2);
		assertEquals(List.of("alpha", "zeta"), ((Mapping) encoder.encode(map)).keys());
	}

	@Test
	void equalMaps_encodeIdenticallyWhateverTheirIterationOrder() {
		// "Aa" and "BB" share a hash code, so these iterate in insertion order
		Map<String, Object> forward = new HashMap<>();
		forward.put("Aa", 1);
		forward.put("BB", 2);
		Map<String, Object> backward = new HashMap<>();
		backward.put("BB", 2);
		backward.put("Aa", 1);
		assertEquals(forward, backward);

		Mapping encoded = encoder.dump(forward);
		assertEquals(encoded.toString(), encoder.dump(backward).toString());
		assertEquals(List.of("version", "Aa", "BB"), encoded.keys());
	}

	@Test
	void map_withTypeKey_throws() {
		assertThrows(IllegalArgumentException.class, () -> encoder.encode(Map.of("type", "sneaky")));
	}

	@Test
	void map_withNonStringKey_throws() {
		assertThrows(IllegalArgumentException.class, () -> encoder.encode(Map.of(1, "one")));
	}

	@Test
	void array_isDescribed() {
		Mapping encoded = (Mapping) encoder.encode(NumericArray.vector(1.0, Double.NaN));
		assertEquals(List.of("type", "shape", "dtype", "data"), encoded.keys());
		assertEquals(Sequence.of(CanonicalValue.of(1.0), new Text("NaN")), encoded.get("data").orElseThrow());
	}

	@Test
	void unregisteredType_throwsNamingTheClass() {
		var e = assertThrows(UnregisteredTypeException.class, () -> encoder.encode(new StringBuilder("nope")));
		assertEquals(StringBuilder.class, e.type());
		assertThat(e.getMessage(), containsString("java.lang.StringBuilder"));
	}

	@Test
	void nestedUnregisteredType_reportsFieldPath() {
		var e = assertThrows(UnregisteredTypeException.class, () ->
			encoder.encode(new Holder(List.of(1, new Holder(new Object())))));
		assertThat(e.getMessage(), containsString("contents: [1]: contents: No registered type for java.lang.Object"));
	}

	@Test
	void encoding_doesNotModifySource() {
		List<Integer> counts = new ArrayList<>(List.of(3, 1, 2));
		Set<Integer> set = new TreeSet<>(List.of(9, 4));
		encoder.encode(new Tally(counts, 6.0));
		encoder.encode(set);
		assertEquals(List.of(3, 1, 2), counts);
		assertEquals(Set.of(4, 9), set);
	}

	@Test
	void dump_putsVersionFirst() {
		Mapping document = encoder.dump(new Point(1, 2));
		assertEquals(List.of("version", "type", "x", "y"), document.keys());
		assertEquals(new Text(FormatVersion.CURRENT.toString()), document.get("version").orElseThrow());
	}

	@Test
	void dump_wrapsNonMappingRoot() {
		Mapping document = encoder.dump(List.of(1, 2));
		assertEquals(List.of("version", "__root__"), document.keys());
	}

	@Test
	void dump_rootWithVersionKey_throws() {
		assertThrows(IllegalArgumentException.class, () -> encoder.dump(Map.of("version", "mine")));
	}

	@Test
	void unfrozenRegistry_isRefused() {
		assertThrows(IllegalStateException.class, () -> new Encoder(TestTypes.registry()));
	}

	@Test
	void fieldWrittenTwice_throws() {
		TypeRegistry registry = new TypeRegistry()
			.register("Twice", Point.class,
				(p, out) -> out.field("x", p.x()).field("x", p.y()),
				in -> new Point(0, 0))
			.freeze();
		assertThrows(IllegalArgumentException.class, () -> new Encoder(registry).encode(new Point(1, 2)));
	}

	@Test
	void reservedFieldName_throws() {
		TypeRegistry registry = new TypeRegistry()
			.register("Sneaky", Point.class,
				(p, out) -> out.field("type", "other"),
				in -> new Point(0, 0))
			.freeze();
		assertThrows(IllegalArgumentException.class, () -> new Encoder(registry).encode(new Point(1, 2)));
	}
}
