package works.phijson.jackson;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.util.DefaultIndenter;
import tools.jackson.core.util.DefaultPrettyPrinter;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.databind.json.JsonMapper;
import works.phijson.CanonicalValue;
import works.phijson.CanonicalValue.Mapping;
import works.phijson.Decoder;
import works.phijson.Encoder;
import works.phijson.TypeRegistry;
import works.phijson.VersionGate;
import works.phijson.exceptions.MalformedDocumentException;
import works.phijson.exceptions.PhiJsonException;
import works.phijson.exceptions.TextParseException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.requireNonNull;

/**
 * Dumps objects to JSON text and loads them back.
 * <p>
 * {@code load(dump(x))} equals {@code x} for anything made of portable values
 * and registered types, and dumping a loaded value reproduces the text byte for byte.
 * <p>
 * Failures are {@link PhiJsonException}s, except that I/O failures are
 * {@link UncheckedIOException}s. Nothing is written to a {@link Writer} or file
 * unless encoding succeeded.
 */
public final class PhiJson {
	private final PhiJsonSettings settings;
	private final Encoder encoder;
	private final Decoder decoder;
	private final ObjectMapper mapper;
	private final ObjectWriter writer;

	/**
	 * @param registry must be frozen
	 */
	public PhiJson(TypeRegistry registry) {
		this(registry, PhiJsonSettings.defaults());
	}

	public PhiJson(TypeRegistry registry, PhiJsonSettings settings) {
		this.settings = requireNonNull(settings);
		this.encoder = new Encoder(registry, settings.getFormatVersion());
		this.decoder = new Decoder(registry, new VersionGate(settings.getFormatVersion()));
		this.mapper = JsonMapper.builder()
			.addModule(new CanonicalValueModule())
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.build();
		if (settings.isIndentOutput()) {
			// Always "\n", whatever the platform line separator
			this.writer = mapper.writer().with(new DefaultPrettyPrinter()
				.withObjectIndenter(new DefaultIndenter("  ", "\n")));
		} else {
			this.writer = mapper.writer();
		}
	}

	public PhiJsonSettings settings() {
		return settings;
	}

	public String dumps(Object value) {
		Mapping document = encoder.dump(value);
		String text = writer.writeValueAsString(document);
		LOGGER.debug("Dumped {} characters", text.length());
		return settings.isTrailingNewline() ? text + "\n" : text;
	}

	/**
	 * Writes the whole document to {@code out} only once it has been encoded.
	 * Doesn't close {@code out}.
	 */
	public void dump(Object value, Writer out) {
		String text = dumps(value);
		try {
			out.write(text);
			out.flush();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Replaces {@code file} atomically: readers see either the old contents or the new,
	 * and if anything goes wrong, the old contents remain.
	 */
	public void dump(Object value, Path file) {
		String text = dumps(value);
		Path directory = file.toAbsolutePath().getParent();
		Path temp = null;
		try {
			temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
			Files.writeString(temp, text, UTF_8);
			moveIntoPlace(temp, file);
		} catch (IOException e) {
			if (temp != null) {
				try {
					Files.deleteIfExists(temp);
				} catch (IOException deletionFailure) {
					e.addSuppressed(deletionFailure);
				}
			}
			throw new UncheckedIOException("Unable to write " + file, e);
		}
		LOGGER.debug("Wrote {}", file);
	}

	private static void moveIntoPlace(Path temp, Path file) throws IOException {
		try {
			Files.move(temp, file, ATOMIC_MOVE, REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			LOGGER.debug("Atomic move not supported for {}; replacing it non-atomically", file, e);
			Files.move(temp, file, REPLACE_EXISTING);
		}
	}

	public Object loads(String text) {
		CanonicalValue tree = parse(text);
		if (tree instanceof Mapping document) {
			return decoder.load(document);
		} else {
			throw new TextParseException("Document must be a JSON object; found " + tree.kind());
		}
	}

	public <T> T loads(String text, Class<T> type) {
		return requireType(loads(text), type);
	}

	public Object load(Reader in) {
		StringWriter text = new StringWriter();
		try {
			in.transferTo(text);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return loads(text.toString());
	}

	public <T> T load(Reader in, Class<T> type) {
		return requireType(load(in), type);
	}

	public Object load(Path file) {
		try {
			return loads(Files.readString(file, UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read " + file, e);
		}
	}

	public <T> T load(Path file, Class<T> type) {
		return requireType(load(file), type);
	}

	/**
	 * Parses JSON text into a value tree without decoding it.
	 *
	 * @throws TextParseException if {@code text} isn't exactly one JSON value
	 */
	public CanonicalValue parse(String text) {
		CanonicalValue result;
		try {
			result = mapper.readValue(text, CanonicalValue.class);
		} catch (JacksonException e) {
			throw new TextParseException(e.getMessage(), e);
		}
		if (result == null) {
			// Jackson maps a bare null without consulting our deserializer
			return CanonicalValue.NULL;
		}
		return result;
	}

	private static <T> T requireType(Object value, Class<T> type) {
		if (type.isInstance(value)) {
			return type.cast(value);
		} else {
			throw new MalformedDocumentException("Expected document root of type " + type.getSimpleName()
				+ "; found " + ((value == null) ? "null" : value.getClass().getSimpleName()));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PhiJson.class);
}
