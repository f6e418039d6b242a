package works.phijson.exceptions;

/**
 * Base of every failure the codec reports.
 * Each subclass names one kind of problem, so callers can tell
 * a document from an incompatible version apart from one that refers to
 * a type nobody registered, without parsing messages.
 */
public sealed abstract class PhiJsonException extends RuntimeException permits
	DuplicateTypeTagException,
	IncompatibleVersionException,
	MalformedArrayException,
	MalformedDocumentException,
	TextParseException,
	UnknownTypeException,
	UnregisteredTypeException
{
	protected PhiJsonException(String message) {
		super(message);
	}

	protected PhiJsonException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same kind as {@code exception}, carrying the same details,
	 * whose message is prefixed with {@code context}.
	 * Used to report the field path at which a nested failure occurred.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends PhiJsonException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof DuplicateTypeTagException e) {
			return (T) new DuplicateTypeTagException(e.tag(), newMessage, e);
		} else if (exception instanceof IncompatibleVersionException e) {
			return (T) new IncompatibleVersionException(e.foundVersion(), e.runningVersion(), newMessage, e);
		} else if (exception instanceof MalformedArrayException e) {
			return (T) new MalformedArrayException(newMessage, e);
		} else if (exception instanceof MalformedDocumentException e) {
			return (T) new MalformedDocumentException(newMessage, e);
		} else if (exception instanceof TextParseException e) {
			return (T) new TextParseException(newMessage, e);
		} else if (exception instanceof UnknownTypeException e) {
			return (T) new UnknownTypeException(e.tag(), newMessage, e);
		} else if (exception instanceof UnregisteredTypeException e) {
			return (T) new UnregisteredTypeException(e.type(), newMessage, e);
		} else {
			throw new IllegalStateException("Unexpected exception type: " + exception.getClass());
		}
	}
}
