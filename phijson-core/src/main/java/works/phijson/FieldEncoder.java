package works.phijson;

/**
 * Writes the persisted fields of one registered type.
 * The order of {@link FieldWriter#field} calls is the order of the fields in the output.
 */
@FunctionalInterface
public interface FieldEncoder<T> {
	void writeFields(T value, FieldWriter out);
}
