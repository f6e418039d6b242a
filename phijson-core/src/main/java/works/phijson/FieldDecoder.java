package works.phijson;

/**
 * Rebuilds one registered type from its already-decoded fields.
 * Derived attributes should be recomputed from these, not read.
 */
@FunctionalInterface
public interface FieldDecoder<T> {
	T readFields(FieldReader in);
}
