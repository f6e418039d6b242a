package works.phijson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.phijson.CanonicalValue.Bool;
import works.phijson.CanonicalValue.Float64;
import works.phijson.CanonicalValue.Int;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.CanonicalValue.Null;
import works.phijson.CanonicalValue.Sequence;
import works.phijson.CanonicalValue.Text;
import works.phijson.array.NumericArrayCodec;
import works.phijson.exceptions.IncompatibleVersionException;
import works.phijson.exceptions.MalformedDocumentException;
import works.phijson.exceptions.PhiJsonException;
import works.phijson.exceptions.UnknownTypeException;

import static java.util.Objects.requireNonNull;
import static works.phijson.ReservedNames.ARRAY_TAG;
import static works.phijson.ReservedNames.ITEMS;
import static works.phijson.ReservedNames.ROOT;
import static works.phijson.ReservedNames.SET_TAG;
import static works.phijson.ReservedNames.TYPE;
import static works.phijson.ReservedNames.VERSION;

/**
 * Turns {@link CanonicalValue} trees back into Java objects,
 * dispatching tagged mappings through the {@link TypeRegistry}.
 * <p>
 * Anything an {@link Encoder} with the same registry produced can be decoded.
 * Anything else fails with a {@link PhiJsonException}; no partially built object
 * is ever returned.
 */
public final class Decoder {
	private final TypeRegistry registry;
	private final VersionGate versionGate;

	public Decoder(TypeRegistry registry) {
		this(registry, new VersionGate(FormatVersion.CURRENT));
	}

	public Decoder(TypeRegistry registry, VersionGate versionGate) {
		registry.requireFrozen(Decoder.class);
		this.registry = registry;
		this.versionGate = requireNonNull(versionGate);
	}

	/**
	 * Decodes a complete document, as produced by {@link Encoder#dump}.
	 * The version stamp is checked before anything else is decoded.
	 *
	 * @throws IncompatibleVersionException if the stamp is missing or the {@link VersionGate} rejects it
	 */
	public Object load(Mapping document) {
		Optional<CanonicalValue> stamp = document.get(VERSION);
		if (stamp.isPresent() && !(stamp.get() instanceof Text)) {
			throw new IncompatibleVersionException(stamp.get().toString(), versionGate.runningVersion().toString(), "Document \"" + VERSION + "\" must be text; found " + stamp.get().kind());
		}
		VersionStamp version = versionGate.enforce(stamp.map(v -> ((Text) v).value()).orElse(null));
		LOGGER.debug("Decoding document with format version {}", version);
		Mapping body = document.without(VERSION);
		if (body.has(ROOT)) {
			if (body.size() != 1) {
				throw new MalformedDocumentException("Document with \"" + ROOT + "\" can't have other fields; found " + body.keys());
			}
			return decodeMember(ROOT, body.get(ROOT).orElseThrow());
		} else {
			return decode(body);
		}
	}

	/**
	 * @throws UnknownTypeException if a mapping is tagged with a type that isn't registered
	 */
	public Object decode(CanonicalValue value) {
		if (value instanceof Null) {
			return null;
		} else if (value instanceof Bool b) {
			return b.value();
		} else if (value instanceof Int i) {
			return i.value();
		} else if (value instanceof Float64 f) {
			return f.value();
		} else if (value instanceof Text t) {
			return t.value();
		} else if (value instanceof Sequence s) {
			return decodeSequence(s);
		} else if (value instanceof Mapping m) {
			return decodeMapping(m);
		} else {
			throw new IllegalStateException("Unexpected value: " + value);
		}
	}

	Object decodeMember(String context, CanonicalValue value) {
		try {
			return decode(value);
		} catch (PhiJsonException e) {
			throw PhiJsonException.wrap(e, context);
		}
	}

	private List<Object> decodeSequence(Sequence sequence) {
		List<Object> result = new ArrayList<>(sequence.size());
		for (int i = 0; i < sequence.size(); i++) {
			result.add(decodeMember("[" + i + "]", sequence.get(i)));
		}
		return Collections.unmodifiableList(result);
	}

	private Object decodeMapping(Mapping mapping) {
		Optional<String> tag = mapping.typeTag();
		if (tag.isEmpty()) {
			return decodeUntagged(mapping);
		}
		switch (tag.get()) {
			case ARRAY_TAG:
				return NumericArrayCodec.decode(mapping);
			case SET_TAG:
				return decodeSet(mapping);
			default:
				return decodeRegistered(tag.get(), mapping);
		}
	}

	private Map<String, Object> decodeUntagged(Mapping mapping) {
		LinkedHashMap<String, Object> result = new LinkedHashMap<>();
		mapping.entries().forEach((key, value) -> result.put(key, decodeMember(key, value)));
		return Collections.unmodifiableMap(result);
	}

	private Set<Object> decodeSet(Mapping mapping) {
		for (String key : mapping.keys()) {
			if (!TYPE.equals(key) && !ITEMS.equals(key)) {
				throw new MalformedDocumentException("Unexpected set member \"" + key + "\"");
			}
		}
		CanonicalValue items = mapping.get(ITEMS)
			.orElseThrow(() -> new MalformedDocumentException("Set is missing \"" + ITEMS + "\""));
		if (!(items instanceof Sequence)) {
			throw new MalformedDocumentException("Set \"" + ITEMS + "\" must be a sequence; found " + items.kind());
		}
		Sequence sequence = (Sequence) items;
		Set<Object> result = new LinkedHashSet<>();
		for (int i = 0; i < sequence.size(); i++) {
			result.add(decodeMember(ITEMS + "[" + i + "]", sequence.get(i)));
		}
		return Collections.unmodifiableSet(result);
	}

	private Object decodeRegistered(String tag, Mapping mapping) {
		RegistryEntry<?> entry = registry.lookupByTag(tag)
			.orElseThrow(() -> new UnknownTypeException(tag));
		LOGGER.trace("Decoding \"{}\"", tag);
		LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
		mapping.entries().forEach((name, value) -> {
			if (!TYPE.equals(name)) {
				fields.put(name, decodeMember(name, value));
			}
		});
		FieldReader reader = new FieldReader(tag, Collections.unmodifiableMap(fields));
		Object result = entry.readFields(reader);
		if (result == null) {
			throw new IllegalStateException("Decoder for \"" + tag + "\" returned null");
		}
		List<String> unread = reader.unreadNames();
		if (!unread.isEmpty()) {
			throw new MalformedDocumentException("Unrecognized field in \"" + tag + "\": " + String.join(", ", unread));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Decoder.class);
}
