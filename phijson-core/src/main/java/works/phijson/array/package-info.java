/**
 * Rectangular numeric arrays and their wire representation.
 */
package works.phijson.array;
