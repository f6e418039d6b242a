/**
 * JSON text for canonical value trees, using the Jackson library.
 * <p>
 * See {@link works.phijson.jackson.PhiJson} for the main entry point.
 */
module works.phijson.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.phijson.core;

	requires static lombok;

	exports works.phijson.jackson;
}
