package works.phijson;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import works.phijson.CanonicalValue.Bool;
import works.phijson.CanonicalValue.Float64;
import works.phijson.CanonicalValue.Int;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.CanonicalValue.Text;

import static java.util.Map.Entry.comparingByKey;

/**
 * A total order over {@link CanonicalValue}s, used to write set items
 * in an order that doesn't depend on how the set was built.
 * <p>
 * Values of different kinds compare by {@link CanonicalValue.Kind kind},
 * except that {@link Int} and {@link Float64} compare by numeric value,
 * with an {@link Int} placed before a {@link Float64} of equal value.
 * Sequences compare element-wise, then by length.
 * Mappings compare entry-wise with entries taken in key order
 * (key first, then value), then by size.
 * Only equal values compare as zero.
 */
public final class CanonicalOrdering implements Comparator<CanonicalValue> {
	public static final CanonicalOrdering INSTANCE = new CanonicalOrdering();

	private CanonicalOrdering() {}

	@Override
	public int compare(CanonicalValue a, CanonicalValue b) {
		int byRank = Integer.compare(rank(a), rank(b));
		if (byRank != 0) {
			return byRank;
		}
		if (a instanceof Bool x && b instanceof Bool y) {
			return Boolean.compare(x.value(), y.value());
		} else if (a instanceof Text x && b instanceof Text y) {
			return x.value().compareTo(y.value());
		} else if (a instanceof Sequence x && b instanceof Sequence y) {
			return compareLists(x.elements(), y.elements());
		} else if (a instanceof Mapping x && b instanceof Mapping y) {
			return compareMappings(x, y);
		} else if (rank(a) == NUMBER_RANK) {
			return compareNumbers(a, b);
		} else {
			// Both null
			return 0;
		}
	}

	private static final int NUMBER_RANK = 2;

	/**
	 * Ints and floats share a rank so that they interleave by value.
	 */
	private static int rank(CanonicalValue value) {
		switch (value.kind()) {
			case NULL: return 0;
			case BOOL: return 1;
			case INT:
			case FLOAT: return NUMBER_RANK;
			case TEXT: return 3;
			case SEQUENCE: return 4;
			case MAPPING: return 5;
			default: throw new IllegalStateException("Unexpected kind: " + value.kind());
		}
	}

	private static int compareNumbers(CanonicalValue a, CanonicalValue b) {
		if (a instanceof Int x && b instanceof Int y) {
			return Long.compare(x.value(), y.value());
		} else if (a instanceof Float64 x && b instanceof Float64 y) {
			return Double.compare(x.value(), y.value());
		} else if (a instanceof Int x && b instanceof Float64 y) {
			int result = compareMixed(x.value(), y.value());
			return (result != 0) ? result : -1;
		} else {
			int result = compareMixed(((Int) b).value(), ((Float64) a).value());
			return (result != 0) ? -result : 1;
		}
	}

	/**
	 * Exact comparison of a long with a finite double, with no rounding of the long.
	 */
	private static int compareMixed(long l, double d) {
		if (d >= 0x1p63) {
			return -1;
		} else if (d < -0x1p63) {
			return 1;
		}
		double floor = Math.floor(d);
		long truncated = (long) floor;
		if (l != truncated) {
			return Long.compare(l, truncated);
		} else {
			return (floor == d) ? 0 : -1;
		}
	}

	private int compareLists(List<CanonicalValue> a, List<CanonicalValue> b) {
		int n = Math.min(a.size(), b.size());
		for (int i = 0; i < n; i++) {
			int result = compare(a.get(i), b.get(i));
			if (result != 0) {
				return result;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	private int compareMappings(Mapping a, Mapping b) {
		List<Map.Entry<String, CanonicalValue>> aEntries = sortedEntries(a);
		List<Map.Entry<String, CanonicalValue>> bEntries = sortedEntries(b);
		int n = Math.min(aEntries.size(), bEntries.size());
		for (int i = 0; i < n; i++) {
			int byKey = aEntries.get(i).getKey().compareTo(bEntries.get(i).getKey());
			if (byKey != 0) {
				return byKey;
			}
			int byValue = compare(aEntries.get(i).getValue(), bEntries.get(i).getValue());
			if (byValue != 0) {
				return byValue;
			}
		}
		return Integer.compare(aEntries.size(), bEntries.size());
	}

	private static List<Map.Entry<String, CanonicalValue>> sortedEntries(Mapping mapping) {
		List<Map.Entry<String, CanonicalValue>> result = new ArrayList<>(mapping.entries().entrySet());
		result.sort(comparingByKey());
		return result;
	}
}
