package works.phijson.models;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.phijson.TypeRegistry;
import works.phijson.exceptions.MalformedDocumentException;

/**
 * Registrations for every result type, under tags that appear in stored fixtures.
 * <p>
 * Tags and field names are part of the document format: renaming one
 * makes existing fixtures unreadable.
 */
public final class ResultModels {
	private ResultModels() {}

	public static final String DIRECTION = "Direction";
	public static final String PART = "Part";
	public static final String K_PARTITION = "KPartition";
	public static final String CUT = "Cut";
	public static final String REPERTOIRE_IRREDUCIBILITY_ANALYSIS = "RepertoireIrreducibilityAnalysis";
	public static final String DISTINCTION = "Distinction";
	public static final String RELATION = "Relation";
	public static final String CAUSE_EFFECT_STRUCTURE = "CauseEffectStructure";
	public static final String SYSTEM_IRREDUCIBILITY_ANALYSIS = "SystemIrreducibilityAnalysis";
	public static final String NULL_SYSTEM_IRREDUCIBILITY_ANALYSIS = "NullSystemIrreducibilityAnalysis";
	public static final String NETWORK_DESCRIPTION = "NetworkDescription";
	public static final String SUBSYSTEM_DESCRIPTION = "SubsystemDescription";

	/**
	 * @return a new frozen registry holding just the result types
	 */
	public static TypeRegistry registry() {
		return registerAll(new TypeRegistry()).freeze();
	}

	/**
	 * Registers every result type.
	 *
	 * @return {@code registry}
	 */
	public static TypeRegistry registerAll(TypeRegistry registry) {
		registry
			.register(DIRECTION, Direction.class,
				(d, out) -> out.field("direction", d.name()),
				in -> in.getEnum("direction", Direction.class))
			.register(PART, Part.class,
				(p, out) -> out
					.field("mechanism", p.mechanism())
					.field("purview", p.purview()),
				in -> new Part(
					in.getIntList("mechanism"),
					in.getIntList("purview")))
			.register(K_PARTITION, KPartition.class,
				(k, out) -> out
					.field("parts", k.parts())
					.field("nodeLabels", k.nodeLabels()),
				in -> new KPartition(
					in.getList("parts", Part.class),
					in.getList("nodeLabels", String.class, List.of())))
			.register(CUT, Cut.class,
				(c, out) -> out
					.field("fromNodes", c.fromNodes())
					.field("toNodes", c.toNodes()),
				in -> new Cut(
					in.getIntList("fromNodes"),
					in.getIntList("toNodes")))
			.register(REPERTOIRE_IRREDUCIBILITY_ANALYSIS, RepertoireIrreducibilityAnalysis.class,
				(r, out) -> out
					.field("phi", r.phi())
					.field("direction", r.direction())
					.field("mechanism", r.mechanism())
					.field("purview", r.purview())
					.field("partition", r.partition())
					.field("repertoire", r.repertoire())
					.field("partitionedRepertoire", r.partitionedRepertoire())
					.field("specifiedState", r.specifiedState()),
				in -> new RepertoireIrreducibilityAnalysis(
					in.getDouble("phi"),
					in.getObject("direction", Direction.class),
					in.getIntList("mechanism"),
					in.getIntList("purview"),
					in.getObject("partition", KPartition.class),
					in.getArray("repertoire"),
					in.getArray("partitionedRepertoire"),
					in.getIntList("specifiedState", List.of())))
			.register(DISTINCTION, Distinction.class,
				(d, out) -> out
					.field("mechanism", d.mechanism())
					.field("cause", d.cause())
					.field("effect", d.effect()),
				in -> new Distinction(
					in.getIntList("mechanism"),
					in.getObject("cause", RepertoireIrreducibilityAnalysis.class),
					in.getObject("effect", RepertoireIrreducibilityAnalysis.class)))
			.register(RELATION, Relation.class,
				(r, out) -> out
					.field("relata", r.relata())
					.field("purview", r.purview())
					.field("phi", r.phi()),
				in -> new Relation(
					in.getSet("relata", Distinction.class),
					in.getIntSet("purview"),
					in.getDouble("phi")))
			.register(CAUSE_EFFECT_STRUCTURE, CauseEffectStructure.class,
				(c, out) -> out
					.field("distinctions", c.distinctions())
					.field("relations", c.relations()),
				in -> new CauseEffectStructure(
					in.getSet("distinctions", Distinction.class),
					in.getSet("relations", Relation.class)))
			.register(SYSTEM_IRREDUCIBILITY_ANALYSIS, SystemIrreducibilityAnalysis.class,
				(s, out) -> out
					.field("phi", s.phi())
					.field("nodeIndices", s.nodeIndices())
					.field("currentState", s.currentState())
					.field("partition", s.partition())
					.field("causeRepertoire", s.causeRepertoire())
					.field("effectRepertoire", s.effectRepertoire()),
				in -> new SystemIrreducibilityAnalysis(
					in.getDouble("phi"),
					in.getIntList("nodeIndices"),
					in.getIntList("currentState"),
					in.getObject("partition", Cut.class),
					in.getArray("causeRepertoire"),
					in.getArray("effectRepertoire")))
			.register(NULL_SYSTEM_IRREDUCIBILITY_ANALYSIS, NullSystemIrreducibilityAnalysis.class,
				(n, out) -> out.field("nodeIndices", n.nodeIndices()),
				in -> new NullSystemIrreducibilityAnalysis(in.getIntList("nodeIndices")))
			.register(NETWORK_DESCRIPTION, NetworkDescription.class,
				(n, out) -> out
					.field("tpm", n.tpm())
					.field("connectivityMatrix", n.connectivityMatrix())
					.field("nodeLabels", n.nodeLabels()),
				in -> {
					try {
						return new NetworkDescription(
							in.getArray("tpm"),
							in.getArray("connectivityMatrix"),
							in.getList("nodeLabels", String.class));
					} catch (IllegalArgumentException e) {
						throw new MalformedDocumentException("\"" + in.tag() + "\": " + e.getMessage(), e);
					}
				})
			.register(SUBSYSTEM_DESCRIPTION, SubsystemDescription.class,
				(s, out) -> out
					.field("network", s.network())
					.field("state", s.state())
					.field("nodeIndices", s.nodeIndices()),
				in -> new SubsystemDescription(
					in.getObject("network", NetworkDescription.class),
					in.getIntList("state"),
					in.getIntList("nodeIndices")));
		LOGGER.debug("Registered result types: {}", registry.tags());
		return registry;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ResultModels.class);
}
