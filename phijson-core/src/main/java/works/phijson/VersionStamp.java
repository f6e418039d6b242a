package works.phijson;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * A semantic version: {@code MAJOR.MINOR.PATCH}, optionally followed by {@code -qualifier}.
 */
public record VersionStamp(int major, int minor, int patch, @Nullable String qualifier) {
	private static final Pattern PATTERN = Pattern.compile("(0|[1-9]\\d{0,8})\\.(0|[1-9]\\d{0,8})\\.(0|[1-9]\\d{0,8})(?:-([0-9A-Za-z.-]+))?");

	public VersionStamp {
		if (major < 0 || minor < 0 || patch < 0) {
			throw new IllegalArgumentException("Version components can't be negative");
		}
	}

	/**
	 * @return empty if {@code text} isn't a well-formed version
	 */
	public static Optional<VersionStamp> tryParse(String text) {
		Matcher m = PATTERN.matcher(text);
		if (!m.matches()) {
			return Optional.empty();
		}
		return Optional.of(new VersionStamp(
			Integer.parseInt(m.group(1)),
			Integer.parseInt(m.group(2)),
			Integer.parseInt(m.group(3)),
			m.group(4)));
	}

	/**
	 * @throws IllegalArgumentException if {@code text} isn't a well-formed version
	 */
	public static VersionStamp parse(String text) {
		return tryParse(text)
			.orElseThrow(() -> new IllegalArgumentException("Malformed version \"" + text + "\""));
	}

	@Override
	public String toString() {
		String base = major + "." + minor + "." + patch;
		return (qualifier == null) ? base : base + "-" + qualifier;
	}
}
