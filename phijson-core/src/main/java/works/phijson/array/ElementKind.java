package works.phijson.array;

import java.util.Optional;

/**
 * The type of every element in a {@link NumericArray},
 * named on the wire by its {@link #dtype()}.
 */
public enum ElementKind {
	FLOAT64("float64"),
	INT64("int64"),
	BOOL("bool");

	private final String dtype;

	ElementKind(String dtype) {
		this.dtype = dtype;
	}

	public String dtype() {
		return dtype;
	}

	public static Optional<ElementKind> fromDtype(String dtype) {
		for (ElementKind kind : values()) {
			if (kind.dtype.equals(dtype)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
