/**
 * Fundamental phijson library: everything needed to turn registered result
 * objects into {@link works.phijson.CanonicalValue canonical value trees} and back.
 * <p>
 * Start with {@link works.phijson the root package} for the
 * {@link works.phijson.TypeRegistry registry}, {@link works.phijson.Encoder encoder}
 * and {@link works.phijson.Decoder decoder}.
 * Additional packages provide numeric arrays ({@link works.phijson.array})
 * and the error taxonomy ({@link works.phijson.exceptions}).
 * Turning trees into text is the job of a format module such as {@code works.phijson.jackson}.
 */
module works.phijson.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	exports works.phijson;
	exports works.phijson.array;
	exports works.phijson.exceptions;
}
