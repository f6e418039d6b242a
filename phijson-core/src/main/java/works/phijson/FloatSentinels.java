package works.phijson;

import java.util.Optional;
import works.phijson.CanonicalValue.Float64;
import works.phijson.CanonicalValue.Text;

/**
 * JSON numbers can't express NaN or the infinities,
 * so those travel as these text values instead.
 */
public final class FloatSentinels {
	private FloatSentinels() {}

	public static final String NAN = "NaN";
	public static final String POSITIVE_INFINITY = "Infinity";
	public static final String NEGATIVE_INFINITY = "-Infinity";

	public static CanonicalValue encode(double value) {
		if (Double.isNaN(value)) {
			return new Text(NAN);
		} else if (value == Double.POSITIVE_INFINITY) {
			return new Text(POSITIVE_INFINITY);
		} else if (value == Double.NEGATIVE_INFINITY) {
			return new Text(NEGATIVE_INFINITY);
		} else {
			return new Float64(value);
		}
	}

	/**
	 * @return the non-finite double named by {@code text}, or empty if it isn't a sentinel
	 */
	public static Optional<Double> decode(String text) {
		switch (text) {
			case NAN: return Optional.of(Double.NaN);
			case POSITIVE_INFINITY: return Optional.of(Double.POSITIVE_INFINITY);
			case NEGATIVE_INFINITY: return Optional.of(Double.NEGATIVE_INFINITY);
			default: return Optional.empty();
		}
	}

	/**
	 * @return the double represented by {@code value}, which must be a
	 * {@link Float64} or a sentinel; empty otherwise
	 */
	public static Optional<Double> decode(CanonicalValue value) {
		if (value instanceof Float64 f) {
			return Optional.of(f.value());
		} else if (value instanceof Text t) {
			return decode(t.value());
		} else {
			return Optional.empty();
		}
	}
}
