package works.phijson.exceptions;

/**
 * A type tag, or a Java type, was registered twice with different codecs.
 */
public final class DuplicateTypeTagException extends PhiJsonException {
	private final String tag;

	public DuplicateTypeTagException(String tag, String message) {
		super(message);
		this.tag = tag;
	}

	public DuplicateTypeTagException(String tag, String message, Throwable cause) {
		super(message, cause);
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}
}
