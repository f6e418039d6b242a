package works.phijson;

import java.util.LinkedHashMap;
import works.phijson.CanonicalValue.Mapping;

import static java.util.Objects.requireNonNull;
import static works.phijson.ReservedNames.TYPE;

/**
 * Collects the fields of one registered object as {@link FieldEncoder} writes them.
 * Each value is encoded as soon as it's written.
 */
public final class FieldWriter {
	private final Encoder encoder;
	private final LinkedHashMap<String, CanonicalValue> fields = new LinkedHashMap<>();

	FieldWriter(Encoder encoder, String tag) {
		this.encoder = encoder;
		fields.put(TYPE, CanonicalValue.of(tag));
	}

	/**
	 * @throws IllegalArgumentException if {@code name} is {@value ReservedNames#TYPE} or was already written
	 */
	public FieldWriter field(String name, Object value) {
		requireNonNull(name);
		if (TYPE.equals(name)) {
			throw new IllegalArgumentException("Field name \"" + TYPE + "\" is reserved");
		} else if (fields.containsKey(name)) {
			throw new IllegalArgumentException("Field \"" + name + "\" written twice");
		}
		fields.put(name, encoder.encodeMember(name, value));
		return this;
	}

	Mapping toMapping() {
		return new Mapping(fields);
	}
}
