package works.phijson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.phijson.array.NumericArray;
import works.phijson.exceptions.MalformedDocumentException;

import static java.util.Objects.requireNonNull;

/**
 * The decoded fields of one registered object, as seen by its {@link FieldDecoder}.
 * <p>
 * Values are already decoded: registered objects are domain objects,
 * integers are {@link Long}, floats are {@link Double}, sequences are {@link List},
 * sets are {@link Set}, untagged mappings are {@link Map}.
 * The typed accessors check this and fail with {@link MalformedDocumentException}
 * rather than coerce.
 * <p>
 * A field that was added in a later format version may be absent from
 * older documents; read such fields with the accessors that take a default.
 * <p>
 * Every field present must be read: the {@link Decoder} rejects an object
 * with fields its {@link FieldDecoder} never asked for. {@link #has} doesn't count as reading.
 */
public final class FieldReader {
	private final String tag;
	private final Map<String, Object> values;
	private final Set<String> read = new HashSet<>();

	FieldReader(String tag, Map<String, Object> values) {
		this.tag = tag;
		this.values = values;
	}

	public String tag() {
		return tag;
	}

	public boolean has(String name) {
		return values.containsKey(name);
	}

	public Set<String> names() {
		return Collections.unmodifiableSet(values.keySet());
	}

	/**
	 * @return the decoded value, which may be null if the document has an explicit null
	 * @throws MalformedDocumentException if the field is absent
	 */
	public @Nullable Object get(String name) {
		if (!values.containsKey(name)) {
			throw problem(name, "missing required field");
		}
		read.add(name);
		return values.get(name);
	}

	public <T> T getObject(String name, Class<T> type) {
		return cast(name, requireNonNullField(name), type);
	}

	public <T> @Nullable T getNullable(String name, Class<T> type) {
		Object value = get(name);
		return (value == null) ? null : cast(name, value, type);
	}

	/**
	 * @return empty if the field is absent or null
	 */
	public <T> Optional<T> getOptional(String name, Class<T> type) {
		read.add(name);
		Object value = values.get(name);
		return (value == null) ? Optional.empty() : Optional.of(cast(name, value, type));
	}

	public String getString(String name) {
		return getObject(name, String.class);
	}

	public boolean getBoolean(String name) {
		return getObject(name, Boolean.class);
	}

	public long getLong(String name) {
		return getObject(name, Long.class);
	}

	public int getInt(String name) {
		return toInt(name, getObject(name, Long.class));
	}

	/**
	 * Accepts a float, or one of the {@link FloatSentinels} for the non-finite values.
	 */
	public double getDouble(String name) {
		return toDouble(name, requireNonNullField(name));
	}

	public double getDouble(String name, double defaultValue) {
		return has(name) ? getDouble(name) : defaultValue;
	}

	public <E extends Enum<E>> E getEnum(String name, Class<E> enumType) {
		Object value = requireNonNullField(name);
		if (enumType.isInstance(value)) {
			return enumType.cast(value);
		} else if (value instanceof String s) {
			try {
				return Enum.valueOf(enumType, s);
			} catch (IllegalArgumentException e) {
				throw new MalformedDocumentException(context(name) + ": no " + enumType.getSimpleName() + " named \"" + s + "\"", e);
			}
		} else {
			throw problem(name, "expected " + enumType.getSimpleName() + "; found " + describe(value));
		}
	}

	public NumericArray getArray(String name) {
		return getObject(name, NumericArray.class);
	}

	public <E> List<E> getList(String name, Class<E> elementType) {
		List<?> list = getObject(name, List.class);
		return Collections.unmodifiableList(castElements(name, list, elementType, new ArrayList<E>()));
	}

	/**
	 * @return the list, or {@code defaultValue} if the field is absent
	 */
	public <E> List<E> getList(String name, Class<E> elementType, List<E> defaultValue) {
		return has(name) ? getList(name, elementType) : defaultValue;
	}

	public <E> Set<E> getSet(String name, Class<E> elementType) {
		Set<?> set = getObject(name, Set.class);
		return Collections.unmodifiableSet(castElements(name, set, elementType, new LinkedHashSet<E>()));
	}

	public List<Integer> getIntList(String name) {
		List<Integer> result = new ArrayList<>();
		for (Long element : getList(name, Long.class)) {
			result.add(toInt(name, element));
		}
		return Collections.unmodifiableList(result);
	}

	public List<Integer> getIntList(String name, List<Integer> defaultValue) {
		return has(name) ? getIntList(name) : defaultValue;
	}

	public Set<Integer> getIntSet(String name) {
		Set<Integer> result = new LinkedHashSet<>();
		for (Long element : getSet(name, Long.class)) {
			result.add(toInt(name, element));
		}
		return Collections.unmodifiableSet(result);
	}

	/**
	 * Like {@link #getList} for floats, restoring the {@link FloatSentinels} as {@link #getDouble} does.
	 */
	public List<Double> getDoubleList(String name) {
		List<Double> result = new ArrayList<>();
		int index = 0;
		for (Object element : getObject(name, List.class)) {
			result.add(toDouble(name + "[" + index + "]", element));
			++index;
		}
		return Collections.unmodifiableList(result);
	}

	public List<Double> getDoubleList(String name, List<Double> defaultValue) {
		return has(name) ? getDoubleList(name) : defaultValue;
	}

	public Set<Double> getDoubleSet(String name) {
		Set<Double> result = new LinkedHashSet<>();
		int index = 0;
		for (Object element : getObject(name, Set.class)) {
			result.add(toDouble(name + "[" + index + "]", element));
			++index;
		}
		return Collections.unmodifiableSet(result);
	}

	public <V> Map<String, V> getMap(String name, Class<V> valueType) {
		Map<?, ?> map = getObject(name, Map.class);
		LinkedHashMap<String, V> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put((String) k, cast(name + "." + k, requireNonNull(v, () -> context(name + "." + k) + " is null"), valueType)));
		return Collections.unmodifiableMap(result);
	}

	/**
	 * @return names present in the document that no accessor has read, in document order
	 */
	List<String> unreadNames() {
		List<String> result = new ArrayList<>();
		for (String name : values.keySet()) {
			if (!read.contains(name)) {
				result.add(name);
			}
		}
		return result;
	}

	private Object requireNonNullField(String name) {
		Object value = get(name);
		if (value == null) {
			throw problem(name, "unexpected null");
		}
		return value;
	}

	private <T> T cast(String name, Object value, Class<T> type) {
		if (type.isInstance(value)) {
			return type.cast(value);
		} else {
			throw problem(name, "expected " + type.getSimpleName() + "; found " + describe(value));
		}
	}

	private <E, C extends Collection<E>> C castElements(String name, Collection<?> source, Class<E> elementType, C destination) {
		int index = 0;
		for (Object element : source) {
			if (element == null) {
				throw problem(name + "[" + index + "]", "unexpected null");
			}
			destination.add(cast(name + "[" + index + "]", element, elementType));
			++index;
		}
		return destination;
	}

	private double toDouble(String name, @Nullable Object value) {
		if (value instanceof Double d) {
			return d;
		} else if (value instanceof String s) {
			return FloatSentinels.decode(s)
				.orElseThrow(() -> problem(name, "expected a float; found text \"" + s + "\""));
		} else if (value == null) {
			throw problem(name, "unexpected null");
		} else {
			throw problem(name, "expected a float; found " + describe(value));
		}
	}

	private int toInt(String name, long value) {
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw problem(name, "value " + value + " is out of int range");
		}
		return (int) value;
	}

	private static String describe(Object value) {
		return value.getClass().getSimpleName() + " " + value;
	}

	private String context(String name) {
		return "\"" + tag + "\"." + name;
	}

	private MalformedDocumentException problem(String name, String message) {
		return new MalformedDocumentException(context(name) + ": " + message);
	}
}
