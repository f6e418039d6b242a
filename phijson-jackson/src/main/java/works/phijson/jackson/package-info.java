/**
 * JSON text for canonical value trees.
 * <p>
 * {@link works.phijson.jackson.PhiJson} dumps and loads documents;
 * {@link works.phijson.jackson.FixtureStore} keeps them as named files.
 */
package works.phijson.jackson;
