package works.phijson;

import static java.util.Objects.requireNonNull;

/**
 * The codec for one registered type.
 */
public record RegistryEntry<T>(
	String tag,
	Class<T> type,
	FieldEncoder<? super T> encoder,
	FieldDecoder<? extends T> decoder
) {
	public RegistryEntry {
		requireNonNull(tag);
		requireNonNull(type);
		requireNonNull(encoder);
		requireNonNull(decoder);
	}

	void writeFields(Object value, FieldWriter out) {
		encoder.writeFields(type.cast(value), out);
	}

	T readFields(FieldReader in) {
		return decoder.readFields(in);
	}
}
