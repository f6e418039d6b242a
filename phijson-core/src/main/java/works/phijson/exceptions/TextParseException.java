package works.phijson.exceptions;

/**
 * The input text is not a well-formed document.
 */
public final class TextParseException extends PhiJsonException {
	public TextParseException(String message) {
		super(message);
	}

	public TextParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
