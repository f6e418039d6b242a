package works.phijson;

/**
 * Keys and tags with fixed meaning in every document.
 * Registered types may not use {@link #TYPE} as a field name,
 * and their tags may not start with {@link #RESERVED_TAG_PREFIX}.
 */
public final class ReservedNames {
	private ReservedNames() {}

	public static final String TYPE = "type";
	public static final String VERSION = "version";

	/**
	 * Holds the document's value when that value doesn't encode to a mapping.
	 */
	public static final String ROOT = "__root__";

	public static final String RESERVED_TAG_PREFIX = "__";
	public static final String ARRAY_TAG = "__array__";
	public static final String SET_TAG = "__set__";

	public static final String ITEMS = "items";
	public static final String SHAPE = "shape";
	public static final String DTYPE = "dtype";
	public static final String DATA = "data";
}
