package works.phijson.exceptions;

/**
 * A document refers to a type tag that isn't in the registry.
 */
public final class UnknownTypeException extends PhiJsonException {
	private final String tag;

	public UnknownTypeException(String tag) {
		this(tag, "No such type tag: \"" + tag + "\"");
	}

	public UnknownTypeException(String tag, String message) {
		super(message);
		this.tag = tag;
	}

	public UnknownTypeException(String tag, String message, Throwable cause) {
		super(message, cause);
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}
}
