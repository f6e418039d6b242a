package works.phijson;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.phijson.exceptions.DuplicateTypeTagException;

import static java.util.Objects.requireNonNull;
import static works.phijson.ReservedNames.RESERVED_TAG_PREFIX;

/**
 * Maps stable type tags to the {@link RegistryEntry codecs} of domain types.
 * <p>
 * Populate with {@link #register}, then {@link #freeze}.
 * Once frozen, the registry never changes and can be read from any thread
 * without synchronization; {@link Encoder} and {@link Decoder} insist on a frozen registry.
 */
public final class TypeRegistry {
	private final Map<String, RegistryEntry<?>> entriesByTag = new LinkedHashMap<>();
	private final Map<Class<?>, RegistryEntry<?>> entriesByType = new HashMap<>();
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	/**
	 * Registering the very same codec for the same tag twice is harmless;
	 * anything else that reuses a tag or a Java type is a conflict.
	 *
	 * @throws DuplicateTypeTagException if {@code tag} or {@code type} is already registered differently
	 * @throws IllegalArgumentException if {@code tag} is blank or starts with {@value ReservedNames#RESERVED_TAG_PREFIX}
	 * @throws IllegalStateException if the registry is frozen
	 */
	public synchronized <T> TypeRegistry register(String tag, Class<T> type, FieldEncoder<? super T> encoder, FieldDecoder<? extends T> decoder) {
		if (isFrozen.get()) {
			throw new IllegalStateException("TypeRegistry is frozen; can't register \"" + tag + "\"");
		}
		requireNonNull(tag);
		if (tag.isBlank()) {
			throw new IllegalArgumentException("Type tag can't be blank");
		} else if (tag.startsWith(RESERVED_TAG_PREFIX)) {
			throw new IllegalArgumentException("Type tag can't start with \"" + RESERVED_TAG_PREFIX + "\": " + tag);
		}
		RegistryEntry<T> entry = new RegistryEntry<>(tag, type, encoder, decoder);
		RegistryEntry<?> existing = entriesByTag.get(tag);
		if (existing != null) {
			if (existing.equals(entry)) {
				LOGGER.debug("Ignoring repeated registration of \"{}\"", tag);
				return this;
			}
			throw new DuplicateTypeTagException(tag, "Type tag \"" + tag + "\" is already registered for " + existing.type().getName());
		}
		RegistryEntry<?> sameType = entriesByType.get(type);
		if (sameType != null) {
			throw new DuplicateTypeTagException(tag, "Type " + type.getName() + " is already registered with tag \"" + sameType.tag() + "\"");
		}
		entriesByTag.put(tag, entry);
		entriesByType.put(type, entry);
		return this;
	}

	public synchronized TypeRegistry freeze() {
		if (!isFrozen.getAndSet(true)) {
			LOGGER.debug("Froze registry with {} types: {}", entriesByTag.size(), entriesByTag.keySet());
		}
		return this;
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	public Optional<RegistryEntry<?>> lookupByTag(String tag) {
		return Optional.ofNullable(entriesByTag.get(tag));
	}

	/**
	 * Tries {@code type} itself, then its superclasses, then its interfaces,
	 * so subclasses and enum constants with bodies resolve to the registered supertype.
	 */
	public Optional<RegistryEntry<?>> lookupByType(Class<?> type) {
		for (Class<?> c = type; c != null; c = c.getSuperclass()) {
			RegistryEntry<?> entry = entriesByType.get(c);
			if (entry != null) {
				return Optional.of(entry);
			}
		}
		Deque<Class<?>> interfaces = new ArrayDeque<>();
		for (Class<?> c = type; c != null; c = c.getSuperclass()) {
			interfaces.addAll(List.of(c.getInterfaces()));
		}
		while (!interfaces.isEmpty()) {
			Class<?> candidate = interfaces.removeFirst();
			RegistryEntry<?> entry = entriesByType.get(candidate);
			if (entry != null) {
				return Optional.of(entry);
			}
			interfaces.addAll(List.of(candidate.getInterfaces()));
		}
		return Optional.empty();
	}

	/**
	 * @return registered tags in registration order
	 */
	public List<String> tags() {
		return List.copyOf(entriesByTag.keySet());
	}

	void requireFrozen(Class<?> user) {
		if (!isFrozen.get()) {
			throw new IllegalStateException(user.getSimpleName() + " requires a frozen TypeRegistry");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
