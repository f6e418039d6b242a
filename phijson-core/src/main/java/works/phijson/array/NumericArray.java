package works.phijson.array;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import works.phijson.exceptions.MalformedArrayException;

import static java.util.stream.Collectors.toList;

/**
 * An immutable rectangular array of numbers or booleans,
 * stored flat in row-major order.
 * <p>
 * Equality is element-wise and bit-exact for {@link ElementKind#FLOAT64}:
 * NaN equals NaN, and {@code 0.0} differs from {@code -0.0}.
 * An array with an empty shape is zero-dimensional and holds one element.
 */
public final class NumericArray {
	private final int[] shape;
	private final ElementKind kind;

	// Exactly one of these is non-null, according to kind
	private final double[] doubles;
	private final long[] longs;
	private final boolean[] booleans;

	private NumericArray(int[] shape, ElementKind kind, double[] doubles, long[] longs, boolean[] booleans) {
		this.shape = shape;
		this.kind = kind;
		this.doubles = doubles;
		this.longs = longs;
		this.booleans = booleans;
		int length = switch (kind) {
			case FLOAT64 -> doubles.length;
			case INT64 -> longs.length;
			case BOOL -> booleans.length;
		};
		long expected = checkedSize(shape);
		if (expected != length) {
			throw new MalformedArrayException("Shape " + Arrays.toString(shape) + " requires " + expected + " elements; found " + length);
		}
	}

	public static NumericArray ofDoubles(int[] shape, double... data) {
		return new NumericArray(shape.clone(), ElementKind.FLOAT64, data.clone(), null, null);
	}

	public static NumericArray ofLongs(int[] shape, long... data) {
		return new NumericArray(shape.clone(), ElementKind.INT64, null, data.clone(), null);
	}

	public static NumericArray ofBooleans(int[] shape, boolean... data) {
		return new NumericArray(shape.clone(), ElementKind.BOOL, null, null, data.clone());
	}

	/**
	 * A one-dimensional float array.
	 */
	public static NumericArray vector(double... data) {
		return ofDoubles(new int[]{data.length}, data);
	}

	/**
	 * A float matrix from its rows, which must all have the same length.
	 */
	public static NumericArray matrix(double[]... rows) {
		int columns = (rows.length == 0) ? 0 : rows[0].length;
		double[] data = new double[rows.length * columns];
		for (int r = 0; r < rows.length; r++) {
			if (rows[r].length != columns) {
				throw new MalformedArrayException("Row " + r + " has " + rows[r].length + " columns; expected " + columns);
			}
			System.arraycopy(rows[r], 0, data, r * columns, columns);
		}
		return new NumericArray(new int[]{rows.length, columns}, ElementKind.FLOAT64, data, null, null);
	}

	public ElementKind kind() {
		return kind;
	}

	public List<Integer> shape() {
		return IntStream.of(shape).boxed().collect(toList());
	}

	public int rank() {
		return shape.length;
	}

	public int size() {
		return (int) checkedSize(shape);
	}

	public double getDouble(int... index) {
		return flatDouble(flatIndex(index));
	}

	public long getLong(int... index) {
		return flatLong(flatIndex(index));
	}

	public boolean getBoolean(int... index) {
		return flatBoolean(flatIndex(index));
	}

	public double flatDouble(int i) {
		return requireKind(ElementKind.FLOAT64).doubles[i];
	}

	public long flatLong(int i) {
		return requireKind(ElementKind.INT64).longs[i];
	}

	public boolean flatBoolean(int i) {
		return requireKind(ElementKind.BOOL).booleans[i];
	}

	/**
	 * @return the same elements, in the same order, with a different shape
	 */
	public NumericArray reshape(int... newShape) {
		return new NumericArray(newShape.clone(), kind, doubles, longs, booleans);
	}

	public double[] toDoubleArray() {
		return requireKind(ElementKind.FLOAT64).doubles.clone();
	}

	public long[] toLongArray() {
		return requireKind(ElementKind.INT64).longs.clone();
	}

	public boolean[] toBooleanArray() {
		return requireKind(ElementKind.BOOL).booleans.clone();
	}

	int flatIndex(int... index) {
		if (index.length != shape.length) {
			throw new IllegalArgumentException("Array of rank " + shape.length + " can't be indexed with " + index.length + " indices");
		}
		int result = 0;
		for (int d = 0; d < shape.length; d++) {
			if (index[d] < 0 || index[d] >= shape[d]) {
				throw new IndexOutOfBoundsException("Index " + index[d] + " out of bounds for axis " + d + " with size " + shape[d]);
			}
			result = result * shape[d] + index[d];
		}
		return result;
	}

	private NumericArray requireKind(ElementKind expected) {
		if (kind != expected) {
			throw new IllegalStateException("Array holds " + kind.dtype() + ", not " + expected.dtype());
		}
		return this;
	}

	private static long checkedSize(int[] shape) {
		long result = 1;
		for (int extent : shape) {
			if (extent < 0) {
				throw new MalformedArrayException("Negative extent in shape " + Arrays.toString(shape));
			}
			result *= extent;
			if (result > Integer.MAX_VALUE) {
				throw new MalformedArrayException("Shape " + Arrays.toString(shape) + " is too large");
			}
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		NumericArray that = (NumericArray) o;
		return kind == that.kind
			&& Arrays.equals(shape, that.shape)
			&& Arrays.equals(doubles, that.doubles)
			&& Arrays.equals(longs, that.longs)
			&& Arrays.equals(booleans, that.booleans);
	}

	@Override
	public int hashCode() {
		int result = kind.hashCode();
		result = 31 * result + Arrays.hashCode(shape);
		result = 31 * result + Arrays.hashCode(doubles);
		result = 31 * result + Arrays.hashCode(longs);
		result = 31 * result + Arrays.hashCode(booleans);
		return result;
	}

	@Override
	public String toString() {
		String data = switch (kind) {
			case FLOAT64 -> Arrays.toString(doubles);
			case INT64 -> Arrays.toString(longs);
			case BOOL -> Arrays.toString(booleans);
		};
		return "NumericArray(" + kind.dtype() + Arrays.toString(shape) + ": " + data + ")";
	}
}
