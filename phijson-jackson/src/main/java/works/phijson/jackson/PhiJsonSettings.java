package works.phijson.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.phijson.FormatVersion;
import works.phijson.VersionStamp;

@Value
@Builder(toBuilder = true)
public class PhiJsonSettings {
	/**
	 * Two-space indentation with one member per line, so fixtures diff well.
	 * Turn off for a single line of text.
	 */
	@Default boolean indentOutput = true;

	/**
	 * Whether text ends with a newline, as most editors expect of a file.
	 */
	@Default boolean trailingNewline = true;

	/**
	 * The version stamped on documents written, and the version documents
	 * read are checked against. Only tests should need to change this.
	 */
	@Default VersionStamp formatVersion = FormatVersion.CURRENT;

	public static PhiJsonSettings defaults() {
		return builder().build();
	}
}
