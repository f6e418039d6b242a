package works.phijson.models;

import java.util.Set;
import lombok.With;

/**
 * An overlap between the purviews of several distinctions.
 */
@With
public record Relation(
	Set<Distinction> relata,
	Set<Integer> purview,
	double phi
) {
	public Relation {
		relata = Set.copyOf(relata);
		purview = Set.copyOf(purview);
	}

	public int degree() {
		return relata.size();
	}
}
