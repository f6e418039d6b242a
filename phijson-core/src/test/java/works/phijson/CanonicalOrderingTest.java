package works.phijson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Sequence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.phijson.CanonicalValue.NULL;
import static works.phijson.CanonicalValue.of;

class CanonicalOrderingTest {
	static final CanonicalOrdering ORDER = CanonicalOrdering.INSTANCE;

	@Test
	void kinds_orderedNullBoolNumberTextSequenceMapping() {
		List<CanonicalValue> expected = List.of(
			NULL,
			of(false),
			of(true),
			of(-3L),
			of(-2.5),
			of(0L),
			of(0.0),
			of(0.5),
			of(1L),
			of(""),
			of("a"),
			of("b"),
			Sequence.of(),
			Sequence.of(of(1L)),
			Sequence.of(of(1L), of(1L)),
			Sequence.of(of(2L)),
			Mapping.empty(),
			mapping("a", of(1L)),
			mapping("a", of(2L)),
			mapping("b", of(0L))
		);
		List<CanonicalValue> shuffled = new ArrayList<>(expected);
		Collections.shuffle(shuffled, new Random(12345));
		shuffled.sort(ORDER);
		assertEquals(expected, shuffled);
	}

	@Test
	void equalValues_compareAsZero() {
		assertEquals(0, ORDER.compare(of(3L), of(3L)));
		assertEquals(0, ORDER.compare(NULL, NULL));
		assertEquals(0, ORDER.compare(
			mapping("x", of(1L), "y", of("two")),
			mapping("y", of("two"), "x", of(1L))));
	}

	@Test
	void intAndFloatOfEqualValue_intFirst() {
		assertTrue(ORDER.compare(of(1L), of(1.0)) < 0);
		assertTrue(ORDER.compare(of(1.0), of(1L)) > 0);
	}

	@Test
	void largeInts_compareExactlyWithFloats() {
		long big = (1L << 53) + 1;
		assertTrue(ORDER.compare(of(big), of((double) (1L << 53))) > 0);
		assertTrue(ORDER.compare(of(Long.MAX_VALUE), of(0x1p63)) < 0);
		assertTrue(ORDER.compare(of(Long.MIN_VALUE), of(-0x1p63)) < 0);
		assertTrue(ORDER.compare(of(-0x1p64), of(Long.MIN_VALUE)) < 0);
	}

	@Test
	void mappings_compareByKeySortedEntries() {
		assertTrue(ORDER.compare(mapping("b", of(1L), "a", of(9L)), mapping("a", of(1L), "c", of(0L))) > 0);
		assertTrue(ORDER.compare(mapping("a", of(1L)), mapping("a", of(1L), "b", of(0L))) < 0);
	}

	static Mapping mapping(Object... keysAndValues) {
		Map<String, CanonicalValue> entries = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			entries.put((String) keysAndValues[i], (CanonicalValue) keysAndValues[i + 1]);
		}
		return new Mapping(entries);
	}
}
