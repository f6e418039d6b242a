package works.phijson.array;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.phijson.CanonicalValue;
import works.phijson.CanonicalValue.Bool;
import works.phijson.CanonicalValue.Int;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.CanonicalValue.Text;
import works.phijson.FloatSentinels;
import works.phijson.exceptions.MalformedArrayException;

import static works.phijson.ReservedNames.ARRAY_TAG;
import static works.phijson.ReservedNames.DATA;
import static works.phijson.ReservedNames.DTYPE;
import static works.phijson.ReservedNames.SHAPE;
import static works.phijson.ReservedNames.TYPE;

/**
 * Converts between {@link NumericArray} and its descriptor mapping:
 * <pre>
 * {"type": "__array__", "shape": [2, 3], "dtype": "float64", "data": [ ...row-major... ]}
 * </pre>
 * Float elements that aren't finite are written as
 * {@link FloatSentinels sentinels}.
 */
public final class NumericArrayCodec {
	private NumericArrayCodec() {}

	public static Mapping encode(NumericArray array) {
		List<CanonicalValue> shape = new ArrayList<>(array.rank());
		for (int extent : array.shape()) {
			shape.add(CanonicalValue.of(extent));
		}
		int size = array.size();
		List<CanonicalValue> data = new ArrayList<>(size);
		switch (array.kind()) {
			case FLOAT64:
				for (int i = 0; i < size; i++) {
					data.add(FloatSentinels.encode(array.flatDouble(i)));
				}
				break;
			case INT64:
				for (int i = 0; i < size; i++) {
					data.add(CanonicalValue.of(array.flatLong(i)));
				}
				break;
			case BOOL:
				for (int i = 0; i < size; i++) {
					data.add(CanonicalValue.of(array.flatBoolean(i)));
				}
				break;
		}
		Map<String, CanonicalValue> result = new LinkedHashMap<>();
		result.put(TYPE, CanonicalValue.of(ARRAY_TAG));
		result.put(SHAPE, new Sequence(shape));
		result.put(DTYPE, CanonicalValue.of(array.kind().dtype()));
		result.put(DATA, new Sequence(data));
		return new Mapping(result);
	}

	/**
	 * @throws MalformedArrayException if the descriptor is missing a member,
	 * names an unknown dtype, has an element that doesn't match the dtype,
	 * or has a shape that doesn't account for exactly the elements given
	 */
	public static NumericArray decode(Mapping descriptor) {
		for (String key : descriptor.keys()) {
			if (!MEMBERS.contains(key)) {
				throw new MalformedArrayException("Unexpected array descriptor member \"" + key + "\"");
			}
		}
		int[] shape = readShape(member(descriptor, SHAPE));
		ElementKind kind = readKind(member(descriptor, DTYPE));
		List<CanonicalValue> data = asSequence(member(descriptor, DATA), DATA).elements();
		checkLength(shape, data.size());
		switch (kind) {
			case FLOAT64: {
				double[] values = new double[data.size()];
				for (int i = 0; i < values.length; i++) {
					int index = i;
					values[i] = FloatSentinels.decode(data.get(i))
						.orElseThrow(() -> elementMismatch(kind, index, data.get(index)));
				}
				return NumericArray.ofDoubles(shape, values);
			}
			case INT64: {
				long[] values = new long[data.size()];
				for (int i = 0; i < values.length; i++) {
					if (data.get(i) instanceof Int n) {
						values[i] = n.value();
					} else {
						throw elementMismatch(kind, i, data.get(i));
					}
				}
				return NumericArray.ofLongs(shape, values);
			}
			case BOOL: {
				boolean[] values = new boolean[data.size()];
				for (int i = 0; i < values.length; i++) {
					if (data.get(i) instanceof Bool b) {
						values[i] = b.value();
					} else {
						throw elementMismatch(kind, i, data.get(i));
					}
				}
				return NumericArray.ofBooleans(shape, values);
			}
			default:
				throw new IllegalStateException("Unexpected element kind: " + kind);
		}
	}

	private static final Set<String> MEMBERS = Set.of(TYPE, SHAPE, DTYPE, DATA);

	private static CanonicalValue member(Mapping descriptor, String name) {
		return descriptor.get(name)
			.orElseThrow(() -> new MalformedArrayException("Array descriptor is missing \"" + name + "\""));
	}

	private static Sequence asSequence(CanonicalValue value, String name) {
		if (value instanceof Sequence s) {
			return s;
		} else {
			throw new MalformedArrayException("Array \"" + name + "\" must be a sequence; found " + value.kind());
		}
	}

	private static int[] readShape(CanonicalValue value) {
		List<CanonicalValue> extents = asSequence(value, SHAPE).elements();
		int[] shape = new int[extents.size()];
		for (int d = 0; d < shape.length; d++) {
			if (extents.get(d) instanceof Int n && n.value() >= 0 && n.value() <= Integer.MAX_VALUE) {
				shape[d] = (int) n.value();
			} else {
				throw new MalformedArrayException("Array shape entry " + d + " must be a non-negative integer; found " + extents.get(d));
			}
		}
		return shape;
	}

	private static ElementKind readKind(CanonicalValue value) {
		if (value instanceof Text t) {
			return ElementKind.fromDtype(t.value())
				.orElseThrow(() -> new MalformedArrayException("Unknown array dtype \"" + t.value() + "\""));
		} else {
			throw new MalformedArrayException("Array dtype must be text; found " + value.kind());
		}
	}

	private static void checkLength(int[] shape, int length) {
		long expected = 1;
		for (int extent : shape) {
			expected *= extent;
			if (expected > Integer.MAX_VALUE) {
				break;
			}
		}
		if (expected != length) {
			throw new MalformedArrayException("Array shape " + Arrays.toString(shape) + " requires " + expected + " elements; data has " + length);
		}
	}

	private static MalformedArrayException elementMismatch(ElementKind kind, int index, CanonicalValue element) {
		return new MalformedArrayException("Array element " + index + " is not " + kind.dtype() + ": " + element);
	}
}
