package works.phijson.exceptions;

/**
 * An array descriptor is inconsistent: its shape doesn't account for its data,
 * its element kind is unknown, or an element doesn't match the kind.
 */
public final class MalformedArrayException extends PhiJsonException {
	public MalformedArrayException(String message) {
		super(message);
	}

	public MalformedArrayException(String message, Throwable cause) {
		super(message, cause);
	}
}
