package works.phijson;

/**
 * Versions of the document format.
 * <ul>
 *     <li>1.0.0: first release.</li>
 *     <li>1.1.0: repertoire analyses gained an optional {@code specifiedState} field.</li>
 * </ul>
 * Readers of an older minor version must treat fields added since then as absent.
 */
public final class FormatVersion {
	private FormatVersion() {}

	public static final VersionStamp V1_0 = new VersionStamp(1, 0, 0, null);
	public static final VersionStamp V1_1 = new VersionStamp(1, 1, 0, null);

	public static final VersionStamp CURRENT = V1_1;
}
