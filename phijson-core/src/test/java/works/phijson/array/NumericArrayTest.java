package works.phijson.array;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.phijson.exceptions.MalformedArrayException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NumericArrayTest {

	@Test
	void matrix_isRowMajor() {
		NumericArray m = NumericArray.matrix(
			new double[]{1, 2, 3},
			new double[]{4, 5, 6});
		assertEquals(List.of(2, 3), m.shape());
		assertEquals(2, m.rank());
		assertEquals(6, m.size());
		assertEquals(6.0, m.getDouble(1, 2));
		assertEquals(4.0, m.flatDouble(3));
		assertEquals(ElementKind.FLOAT64, m.kind());
	}

	@Test
	void raggedMatrix_throws() {
		assertThrows(MalformedArrayException.class, () -> NumericArray.matrix(
			new double[]{1, 2},
			new double[]{3}));
	}

	@Test
	void shapeMismatch_throws() {
		assertThrows(MalformedArrayException.class, () -> NumericArray.ofLongs(new int[]{2, 2}, 1, 2, 3));
		assertThrows(MalformedArrayException.class, () -> NumericArray.ofBooleans(new int[]{-1}));
	}

	@Test
	void emptyAndScalarShapes() {
		NumericArray empty = NumericArray.ofDoubles(new int[]{0, 4});
		assertEquals(0, empty.size());
		NumericArray scalar = NumericArray.ofLongs(new int[]{}, 42);
		assertEquals(0, scalar.rank());
		assertEquals(1, scalar.size());
		assertEquals(42, scalar.getLong());
	}

	@Test
	void equality_isBitExact() {
		assertEquals(NumericArray.vector(Double.NaN, 1.0), NumericArray.vector(Double.NaN, 1.0));
		assertEquals(NumericArray.vector(Double.NaN).hashCode(), NumericArray.vector(Double.NaN).hashCode());
		assertNotEquals(NumericArray.vector(0.0), NumericArray.vector(-0.0));
		assertNotEquals(NumericArray.vector(1.0, 2.0), NumericArray.vector(1.0, 2.0).reshape(2, 1));
		assertNotEquals(NumericArray.ofLongs(new int[]{1}, 1), NumericArray.vector(1.0));
	}

	@Test
	void copies_areDefensive() {
		double[] data = {1, 2};
		NumericArray array = NumericArray.vector(data);
		data[0] = 99;
		assertEquals(1.0, array.getDouble(0));
		array.toDoubleArray()[1] = 99;
		assertEquals(2.0, array.getDouble(1));
	}

	@Test
	void reshape_keepsElements() {
		NumericArray reshaped = NumericArray.vector(1, 2, 3, 4, 5, 6).reshape(3, 2);
		assertEquals(List.of(3, 2), reshaped.shape());
		assertEquals(4.0, reshaped.getDouble(1, 1));
		assertThrows(MalformedArrayException.class, () -> reshaped.reshape(4));
	}

	@Test
	void badIndexing_throws() {
		NumericArray m = NumericArray.vector(1, 2);
		assertThrows(IllegalArgumentException.class, () -> m.getDouble(0, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> m.getDouble(2));
		assertThrows(IllegalStateException.class, () -> m.getLong(0));
	}

	@Test
	void booleans() {
		NumericArray b = NumericArray.ofBooleans(new int[]{2}, true, false);
		assertArrayEquals(new boolean[]{true, false}, b.toBooleanArray());
		assertEquals(ElementKind.BOOL, b.kind());
	}
}
