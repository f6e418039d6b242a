package works.phijson.exceptions;

/**
 * The encoder was given an object whose class has no registry entry
 * and no built-in representation.
 */
public final class UnregisteredTypeException extends PhiJsonException {
	private final Class<?> type;

	public UnregisteredTypeException(Class<?> type) {
		this(type, "No registered type for " + type.getName());
	}

	public UnregisteredTypeException(Class<?> type, String message) {
		super(message);
		this.type = type;
	}

	public UnregisteredTypeException(Class<?> type, String message, Throwable cause) {
		super(message, cause);
		this.type = type;
	}

	public Class<?> type() {
		return type;
	}
}
