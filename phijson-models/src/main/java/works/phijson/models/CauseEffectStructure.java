package works.phijson.models;

import java.util.Set;
import lombok.With;

@With
public record CauseEffectStructure(
	Set<Distinction> distinctions,
	Set<Relation> relations
) {
	public CauseEffectStructure {
		distinctions = Set.copyOf(distinctions);
		relations = Set.copyOf(relations);
	}

	public static CauseEffectStructure empty() {
		return new CauseEffectStructure(Set.of(), Set.of());
	}

	/**
	 * Total φ of every distinction and relation.
	 */
	public double sumPhi() {
		double result = 0.0;
		for (Distinction d : distinctions) {
			result += d.phi();
		}
		for (Relation r : relations) {
			result += r.phi();
		}
		return result;
	}
}
