package works.phijson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.array.NumericArray;
import works.phijson.array.NumericArrayCodec;
import works.phijson.exceptions.PhiJsonException;
import works.phijson.exceptions.UnregisteredTypeException;

import static java.util.Objects.requireNonNull;
import static works.phijson.ReservedNames.ITEMS;
import static works.phijson.ReservedNames.ROOT;
import static works.phijson.ReservedNames.SET_TAG;
import static works.phijson.ReservedNames.TYPE;
import static works.phijson.ReservedNames.VERSION;

/**
 * Turns Java objects into {@link CanonicalValue} trees.
 * <p>
 * Portable values map directly; registered objects become mappings
 * tagged with their {@link ReservedNames#TYPE type}, holding the fields
 * their {@link FieldEncoder} writes, in the order it writes them.
 * Sets are written with their items in {@link CanonicalOrdering canonical order}
 * and plain maps with their keys sorted, so encoding the same logical value
 * always produces the same tree.
 * <p>
 * Encoding never modifies the object or the registry.
 */
public final class Encoder {
	private final TypeRegistry registry;
	private final VersionStamp version;

	public Encoder(TypeRegistry registry) {
		this(registry, FormatVersion.CURRENT);
	}

	/**
	 * @param version stamped at the root of every {@link #dump document}
	 */
	public Encoder(TypeRegistry registry, VersionStamp version) {
		registry.requireFrozen(Encoder.class);
		this.registry = registry;
		this.version = requireNonNull(version);
	}

	public VersionStamp version() {
		return version;
	}

	/**
	 * @throws UnregisteredTypeException if {@code value}, or anything it contains,
	 * is neither a portable value nor a registered type
	 */
	public CanonicalValue encode(Object value) {
		if (value == null) {
			return CanonicalValue.NULL;
		}
		Optional<RegistryEntry<?>> entry = registry.lookupByType(value.getClass());
		if (entry.isPresent()) {
			return encodeRegistered(entry.get(), value);
		} else if (value instanceof Boolean b) {
			return CanonicalValue.of(b);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return CanonicalValue.of(((Number) value).longValue());
		} else if (value instanceof Double || value instanceof Float) {
			return FloatSentinels.encode(((Number) value).doubleValue());
		} else if (value instanceof String s) {
			return CanonicalValue.of(s);
		} else if (value instanceof Enum<?> e) {
			return CanonicalValue.of(e.name());
		} else if (value instanceof NumericArray array) {
			return NumericArrayCodec.encode(array);
		} else if (value instanceof Set<?> set) {
			return encodeSet(set);
		} else if (value instanceof Collection<?> collection) {
			return encodeSequence(collection);
		} else if (value instanceof Map<?, ?> map) {
			return encodeMap(map);
		} else {
			throw new UnregisteredTypeException(value.getClass());
		}
	}

	/**
	 * Encodes {@code root} as a complete document: a mapping whose first
	 * key is {@value ReservedNames#VERSION}. If {@code root} encodes to a mapping,
	 * its keys follow; otherwise its value appears under {@value ReservedNames#ROOT}.
	 *
	 * @throws IllegalArgumentException if the root mapping already uses one of those keys
	 */
	public Mapping dump(Object root) {
		LOGGER.debug("Encoding document for {}", (root == null) ? "null" : root.getClass());
		CanonicalValue encoded = encode(root);
		LinkedHashMap<String, CanonicalValue> document = new LinkedHashMap<>();
		document.put(VERSION, CanonicalValue.of(version.toString()));
		if (encoded instanceof Mapping m) {
			for (String reserved : List.of(VERSION, ROOT)) {
				if (m.has(reserved)) {
					throw new IllegalArgumentException("Document root can't have a field named \"" + reserved + "\"");
				}
			}
			document.putAll(m.entries());
		} else {
			document.put(ROOT, encoded);
		}
		return new Mapping(document);
	}

	/**
	 * Encodes a value nested within another, naming it in any resulting error.
	 */
	CanonicalValue encodeMember(String context, Object value) {
		try {
			return encode(value);
		} catch (PhiJsonException e) {
			throw PhiJsonException.wrap(e, context);
		}
	}

	private Mapping encodeRegistered(RegistryEntry<?> entry, Object value) {
		LOGGER.trace("Encoding {} as \"{}\"", value.getClass().getSimpleName(), entry.tag());
		FieldWriter writer = new FieldWriter(this, entry.tag());
		entry.writeFields(value, writer);
		return writer.toMapping();
	}

	private Mapping encodeSet(Set<?> set) {
		List<CanonicalValue> items = new ArrayList<>(set.size());
		for (Object element : set) {
			items.add(encodeMember(ITEMS, element));
		}
		items.sort(CanonicalOrdering.INSTANCE);
		LinkedHashMap<String, CanonicalValue> result = new LinkedHashMap<>();
		result.put(TYPE, CanonicalValue.of(SET_TAG));
		result.put(ITEMS, new Sequence(items));
		return new Mapping(result);
	}

	private Sequence encodeSequence(Collection<?> collection) {
		List<CanonicalValue> elements = new ArrayList<>(collection.size());
		int index = 0;
		for (Object element : collection) {
			elements.add(encodeMember("[" + index + "]", element));
			++index;
		}
		return new Sequence(elements);
	}

	/**
	 * Keys are written in {@link String} order, since two equal maps may iterate differently.
	 */
	private Mapping encodeMap(Map<?, ?> map) {
		TreeMap<String, Object> sorted = new TreeMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (!(entry.getKey() instanceof String)) {
				throw new IllegalArgumentException("Map keys must be strings; found " + entry.getKey());
			}
			String key = (String) entry.getKey();
			if (TYPE.equals(key)) {
				throw new IllegalArgumentException("Map key \"" + TYPE + "\" is reserved");
			}
			sorted.put(key, entry.getValue());
		}
		LinkedHashMap<String, CanonicalValue> result = new LinkedHashMap<>();
		sorted.forEach((key, value) -> result.put(key, encodeMember(key, value)));
		return new Mapping(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Encoder.class);
}
