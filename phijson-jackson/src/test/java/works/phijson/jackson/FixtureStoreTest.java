package works.phijson.jackson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.phijson.models.CauseEffectStructure;
import works.phijson.models.Cut;
import works.phijson.models.ResultModels;
import works.phijson.models.SystemIrreducibilityAnalysis;
import works.phijson.testing.SampleResults;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FixtureStoreTest {
	@TempDir Path dir;
	FixtureStore store;
	PhiJson phiJson;

	@BeforeEach
	void setUp() {
		phiJson = new PhiJson(ResultModels.registry());
		store = new FixtureStore(dir.resolve("fixtures"), phiJson);
	}

	@Test
	void writeThenRead() {
		Path file = store.write("sia", SampleResults.systemAnalysis());
		assertEquals(dir.resolve("fixtures").resolve("sia.json"), file);
		assertTrue(store.exists("sia"));
		assertEquals(SampleResults.systemAnalysis(), store.read("sia"));
		assertEquals(SampleResults.systemAnalysis(), store.read("sia", SystemIrreducibilityAnalysis.class));
	}

	@Test
	void verify_passesForFreshFixture() {
		store.write("ces", SampleResults.causeEffectStructure());
		FixtureReport report = store.verify("ces", SampleResults.causeEffectStructure());
		assertTrue(report.equal());
		assertTrue(report.byteIdentical());
		assertTrue(report.passed());
		assertEquals("ces", report.name());
	}

	@Test
	void verify_detectsChangedValue() {
		store.write("cut", new Cut(List.of(0), List.of(1)));
		FixtureReport report = store.verify("cut", new Cut(List.of(1), List.of(0)));
		assertFalse(report.equal());
		assertTrue(report.byteIdentical());
		assertFalse(report.passed());
	}

	@Test
	void verify_detectsReformattedText() throws IOException {
		Path file = store.write("cut", new Cut(List.of(0), List.of(1)));
		PhiJson compact = new PhiJson(ResultModels.registry(), PhiJsonSettings.builder().indentOutput(false).build());
		Files.writeString(file, compact.dumps(new Cut(List.of(0), List.of(1))), UTF_8);
		FixtureReport report = store.verify("cut", new Cut(List.of(0), List.of(1)));
		assertTrue(report.equal());
		assertFalse(report.byteIdentical());
	}

	@Test
	void rewrite_replacesFixture() {
		store.write("x", new Cut(List.of(0), List.of(1)));
		store.write("x", CauseEffectStructure.empty());
		assertEquals(CauseEffectStructure.empty(), store.read("x"));
	}

	@Test
	void names_areSortedAndIgnoreOtherFiles() throws IOException {
		assertEquals(List.of(), store.names());
		store.write("b", new Cut(List.of(0), List.of(1)));
		store.write("a.v2", new Cut(List.of(0), List.of(1)));
		store.write("C_3-x", new Cut(List.of(0), List.of(1)));
		Files.writeString(store.directory().resolve("notes.txt"), "not a fixture");
		Files.writeString(store.directory().resolve(".hidden.json"), "{}");
		Files.createDirectories(store.directory().resolve("sub.json"));
		assertEquals(List.of("C_3-x", "a.v2", "b"), store.names());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", ".hidden", "../escape", "a/b", "with space", "ümlaut"})
	void invalidNames_throw(String name) {
		assertThrows(IllegalArgumentException.class, () -> store.write(name, new Cut(List.of(0), List.of(1))));
		assertThrows(IllegalArgumentException.class, () -> store.read(name));
	}

	@Test
	void missingFixture_throwsUnchecked() {
		assertFalse(store.exists("nope"));
		assertThrows(UncheckedIOException.class, () -> store.read("nope"));
		assertThrows(UncheckedIOException.class, () -> store.verify("nope", null));
	}
}
