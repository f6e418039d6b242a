package works.phijson.jackson;

/**
 * The outcome of {@link FixtureStore#verify}.
 *
 * @param equal whether the stored fixture decodes to the expected value
 * @param byteIdentical whether dumping the decoded value reproduces the stored text exactly
 */
public record FixtureReport(String name, boolean equal, boolean byteIdentical) {
	public boolean passed() {
		return equal && byteIdentical;
	}
}
