package works.phijson.testing;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.Named;
import works.phijson.array.NumericArray;
import works.phijson.models.CauseEffectStructure;
import works.phijson.models.Cut;
import works.phijson.models.Direction;
import works.phijson.models.Distinction;
import works.phijson.models.KPartition;
import works.phijson.models.NetworkDescription;
import works.phijson.models.NullSystemIrreducibilityAnalysis;
import works.phijson.models.Part;
import works.phijson.models.Relation;
import works.phijson.models.RepertoireIrreducibilityAnalysis;
import works.phijson.models.SubsystemDescription;
import works.phijson.models.SystemIrreducibilityAnalysis;

import static org.junit.jupiter.api.Named.named;
import static works.phijson.models.Direction.CAUSE;
import static works.phijson.models.Direction.EFFECT;

/**
 * Representative result values, shaped like the fixtures of a small three-node network.
 * Every method builds fresh objects.
 */
public final class SampleResults {
	private SampleResults() {}

	/**
	 * A two-by-three float array with a NaN and an infinity among ordinary values.
	 */
	public static NumericArray floatGrid() {
		return NumericArray.matrix(
			new double[]{0.0, 0.5, Double.NaN},
			new double[]{1.0, Double.POSITIVE_INFINITY, -2.5});
	}

	public static RepertoireIrreducibilityAnalysis repertoireAnalysis(Direction direction, List<Integer> mechanism, double phi) {
		return new RepertoireIrreducibilityAnalysis(
			phi,
			direction,
			mechanism,
			List.of(0, 2),
			KPartition.of(
				new Part(mechanism, List.of()),
				new Part(List.of(), List.of(0, 2))),
			NumericArray.ofDoubles(new int[]{2, 1, 2}, 0.5, 0.0, 0.25, 0.25),
			NumericArray.ofDoubles(new int[]{2, 1, 2}, 0.25, 0.25, 0.25, 0.25),
			List.of(1, 0));
	}

	public static Distinction distinction(List<Integer> mechanism, double causePhi, double effectPhi) {
		return new Distinction(
			mechanism,
			repertoireAnalysis(CAUSE, mechanism, causePhi),
			repertoireAnalysis(EFFECT, mechanism, effectPhi));
	}

	public static List<Distinction> distinctions() {
		return List.of(
			distinction(List.of(0), 0.25, 0.5),
			distinction(List.of(1), 0.125, 0.375),
			distinction(List.of(0, 1), 0.5, 0.25));
	}

	/**
	 * The {@link #distinctions()} in a set that iterates in the order they were added.
	 *
	 * @param reversed whether to add them in the opposite order,
	 * which must make no difference to the encoding
	 */
	public static Set<Distinction> distinctionSet(boolean reversed) {
		return insertionOrdered(distinctions(), reversed);
	}

	public static CauseEffectStructure causeEffectStructure() {
		List<Distinction> d = distinctions();
		return new CauseEffectStructure(
			Set.copyOf(d),
			Set.of(
				new Relation(Set.of(d.get(0), d.get(1)), Set.of(0), 0.125),
				new Relation(Set.of(d.get(0), d.get(1), d.get(2)), Set.of(0, 2), 0.0625)));
	}

	public static SystemIrreducibilityAnalysis systemAnalysis() {
		return new SystemIrreducibilityAnalysis(
			2.3125,
			List.of(0, 1, 2),
			List.of(1, 0, 0),
			new Cut(List.of(0), List.of(1, 2)),
			floatGrid(),
			NumericArray.ofDoubles(new int[]{2, 3}, 0.125, 0.25, 0.0, Double.NEGATIVE_INFINITY, -0.0, 1e-300));
	}

	public static NetworkDescription network() {
		return new NetworkDescription(
			NumericArray.ofDoubles(new int[]{8, 3},
				0, 0, 0,
				0, 0, 1,
				1, 0, 1,
				1, 0, 0,
				1, 1, 0,
				1, 1, 1,
				1, 1, 1,
				1, 1, 0),
			NumericArray.ofLongs(new int[]{3, 3},
				0, 0, 1,
				1, 0, 1,
				1, 1, 0),
			List.of("A", "B", "C"));
	}

	public static SubsystemDescription subsystem() {
		return new SubsystemDescription(network(), List.of(1, 0, 0), List.of(0, 1, 2));
	}

	/**
	 * An untagged root holding an array, a set of three, and a registered sub-object.
	 */
	public static Map<String, Object> composite() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("array", floatGrid());
		result.put("labels", Set.of("C", "A", "B"));
		result.put("cut", new Cut(List.of(1), List.of(0)));
		return result;
	}

	/**
	 * Every sample, named for test reports.
	 */
	public static Stream<Named<Object>> all() {
		return Stream.of(
			named("direction", EFFECT),
			named("part", new Part(List.of(0), List.of())),
			named("kPartition", new KPartition(List.of(new Part(List.of(0), List.of(1)), new Part(List.of(1), List.of(0))), List.of("A", "B"))),
			named("cut", new Cut(List.of(0, 1), List.of(2))),
			named("repertoireAnalysis", repertoireAnalysis(CAUSE, List.of(0, 1), 0.5)),
			named("distinction", distinctions().get(2)),
			named("relation", causeEffectStructure().relations().iterator().next()),
			named("causeEffectStructure", causeEffectStructure()),
			named("distinctionSet", distinctionSet(false)),
			named("emptyCauseEffectStructure", CauseEffectStructure.empty()),
			named("systemAnalysis", systemAnalysis()),
			named("nullSystemAnalysis", new NullSystemIrreducibilityAnalysis(List.of(2))),
			named("network", network()),
			named("subsystem", subsystem()),
			named("composite", composite()),
			named("floatGrid", floatGrid()),
			named("plainList", List.of(1L, "two", 3.5, true)),
			named("plainText", "just text")
		);
	}

	private static <T> Set<T> insertionOrdered(List<T> items, boolean reversed) {
		Set<T> result = new LinkedHashSet<>();
		for (int i = 0; i < items.size(); i++) {
			result.add(items.get(reversed ? items.size() - 1 - i : i));
		}
		return result;
	}
}
