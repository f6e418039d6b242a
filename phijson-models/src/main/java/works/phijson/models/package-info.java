/**
 * Immutable records for the results of integrated-information analyses.
 * <p>
 * Derived quantities such as {@link works.phijson.models.Distinction#phi()}
 * are methods, never stored fields, so they're recomputed after decoding.
 */
package works.phijson.models;
