package works.phijson.exceptions;

/**
 * The value tree is well formed, but its content doesn't match what
 * the decoder expects: a required field is missing, a field holds the wrong
 * kind of value, or a reserved key holds something other than text.
 */
public final class MalformedDocumentException extends PhiJsonException {
	public MalformedDocumentException(String message) {
		super(message);
	}

	public MalformedDocumentException(String message, Throwable cause) {
		super(message, cause);
	}
}
