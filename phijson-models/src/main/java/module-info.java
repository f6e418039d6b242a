/**
 * The result objects stored in fixtures, and their registrations.
 * <p>
 * See {@link works.phijson.models.ResultModels} to populate a registry.
 */
module works.phijson.models {
	requires transitive works.phijson.core;
	requires org.slf4j;

	requires static lombok;

	exports works.phijson.models;
}
