/**
 * The failures the codec reports.
 * All of them extend {@link works.phijson.exceptions.PhiJsonException}
 * and none of them is retried internally.
 */
package works.phijson.exceptions;
