package works.phijson;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.phijson.exceptions.IncompatibleVersionException;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a document stamped with some format version
 * can be decoded by a codec running a given version.
 * <p>
 * Within one major version, a document from an older minor version is accepted
 * with a warning: its decoders must default the fields added since.
 * A document from a newer minor version is refused, because it may carry
 * fields this codec would silently drop.
 */
public final class VersionGate {
	private final VersionStamp running;

	public enum Verdict {
		PROCEED,
		PROCEED_WITH_WARNING,
		REJECT
	}

	public VersionGate(VersionStamp running) {
		this.running = requireNonNull(running);
	}

	public VersionStamp runningVersion() {
		return running;
	}

	/**
	 * @param stamp null if the document has none
	 */
	public Verdict check(@Nullable VersionStamp stamp) {
		if (stamp == null || stamp.major() != running.major()) {
			return Verdict.REJECT;
		} else if (stamp.minor() == running.minor()) {
			return Verdict.PROCEED;
		} else if (stamp.minor() < running.minor()) {
			return Verdict.PROCEED_WITH_WARNING;
		} else {
			return Verdict.REJECT;
		}
	}

	/**
	 * Parses and {@link #check checks} a stamp as it appeared in a document.
	 *
	 * @param stampText null if the document has none
	 * @return the parsed stamp, if decoding may proceed
	 * @throws IncompatibleVersionException if it may not
	 */
	public VersionStamp enforce(@Nullable String stampText) {
		if (stampText == null) {
			throw new IncompatibleVersionException(null, running.toString(), "Document has no \"" + ReservedNames.VERSION + "\" stamp; expected " + running);
		}
		VersionStamp stamp = VersionStamp.tryParse(stampText)
			.orElseThrow(() -> new IncompatibleVersionException(stampText, running.toString(), "Malformed document version \"" + stampText + "\""));
		switch (check(stamp)) {
			case PROCEED:
				break;
			case PROCEED_WITH_WARNING:
				LOGGER.warn("Document has older format version {}; running {}. Fields added since will take default values.", stamp, running);
				break;
			default:
				throw new IncompatibleVersionException(stampText, running.toString(), "Document format version " + stamp + " is incompatible with running version " + running);
		}
		return stamp;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(VersionGate.class);
}
