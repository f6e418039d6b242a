package works.phijson.jackson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * A directory of named fixtures, each stored as {@code <name>.json}.
 * <p>
 * Writes are atomic, so an interrupted run never leaves a truncated fixture behind.
 */
public final class FixtureStore {
	public static final String EXTENSION = ".json";

	private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.-]+");

	private final Path directory;
	private final PhiJson codec;

	public FixtureStore(Path directory, PhiJson codec) {
		this.directory = requireNonNull(directory);
		this.codec = requireNonNull(codec);
	}

	public Path directory() {
		return directory;
	}

	/**
	 * @throws IllegalArgumentException if {@code name} isn't a valid fixture name
	 */
	public Path pathFor(String name) {
		if (!isValidName(name)) {
			throw new IllegalArgumentException("Invalid fixture name: \"" + name + "\"");
		}
		return directory.resolve(name + EXTENSION);
	}

	public static boolean isValidName(String name) {
		return NAME.matcher(name).matches() && !name.startsWith(".");
	}

	public boolean exists(String name) {
		return Files.isRegularFile(pathFor(name));
	}

	/**
	 * Creates the directory if necessary, then replaces any existing fixture of the same name.
	 *
	 * @return the fixture's file
	 */
	public Path write(String name, Object value) {
		Path file = pathFor(name);
		try {
			Files.createDirectories(directory);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to create fixture directory " + directory, e);
		}
		codec.dump(value, file);
		LOGGER.info("Wrote fixture \"{}\" to {}", name, file);
		return file;
	}

	public Object read(String name) {
		return codec.load(pathFor(name));
	}

	public <T> T read(String name, Class<T> type) {
		return codec.load(pathFor(name), type);
	}

	/**
	 * Checks that a stored fixture still means {@code expected}
	 * and is exactly what the codec would write today.
	 */
	public FixtureReport verify(String name, Object expected) {
		Path file = pathFor(name);
		String stored;
		try {
			stored = Files.readString(file, UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read fixture " + file, e);
		}
		Object actual = codec.loads(stored);
		FixtureReport report = new FixtureReport(
			name,
			Objects.equals(expected, actual),
			stored.equals(codec.dumps(actual)));
		if (report.passed()) {
			LOGGER.debug("Fixture \"{}\" verified", name);
		} else {
			LOGGER.warn("Fixture \"{}\" failed verification: {}", name, report);
		}
		return report;
	}

	/**
	 * @return the names of stored fixtures, sorted; empty if the directory doesn't exist
	 */
	public List<String> names() {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(directory)) {
			return files
				.filter(Files::isRegularFile)
				.map(p -> p.getFileName().toString())
				.filter(f -> f.endsWith(EXTENSION))
				.map(f -> f.substring(0, f.length() - EXTENSION.length()))
				.filter(FixtureStore::isValidName)
				.sorted()
				.collect(toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to list fixtures in " + directory, e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FixtureStore.class);
}
