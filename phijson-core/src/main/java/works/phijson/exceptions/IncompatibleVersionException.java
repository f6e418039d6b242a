package works.phijson.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * A document's format version can't be decoded by the running codec,
 * or the document has no usable version stamp at all.
 */
public final class IncompatibleVersionException extends PhiJsonException {
	@Nullable
	private final String foundVersion;
	private final String runningVersion;

	public IncompatibleVersionException(@Nullable String foundVersion, String runningVersion, String message) {
		super(message);
		this.foundVersion = foundVersion;
		this.runningVersion = runningVersion;
	}

	public IncompatibleVersionException(@Nullable String foundVersion, String runningVersion, String message, Throwable cause) {
		super(message, cause);
		this.foundVersion = foundVersion;
		this.runningVersion = runningVersion;
	}

	/**
	 * @return the stamp text as it appeared in the document, or null if it was absent
	 */
	public @Nullable String foundVersion() {
		return foundVersion;
	}

	public String runningVersion() {
		return runningVersion;
	}
}
