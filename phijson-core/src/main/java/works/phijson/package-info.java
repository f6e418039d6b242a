/**
 * The codec proper.
 * <p>
 * A {@link works.phijson.TypeRegistry} maps stable tags to the codecs of domain types.
 * Once {@link works.phijson.TypeRegistry#freeze frozen}, it drives an
 * {@link works.phijson.Encoder} that produces {@link works.phijson.CanonicalValue} trees
 * and a {@link works.phijson.Decoder} that turns them back into equal objects,
 * after the {@link works.phijson.VersionGate} has vetted the document's version.
 */
package works.phijson;
