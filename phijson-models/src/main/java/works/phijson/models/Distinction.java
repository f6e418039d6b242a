package works.phijson.models;

import java.util.List;
import lombok.With;

/**
 * A mechanism together with its maximally irreducible cause and effect.
 */
@With
public record Distinction(
	List<Integer> mechanism,
	RepertoireIrreducibilityAnalysis cause,
	RepertoireIrreducibilityAnalysis effect
) {
	public Distinction {
		mechanism = List.copyOf(mechanism);
	}

	/**
	 * Not stored; always the smaller of the cause and effect values.
	 */
	public double phi() {
		return Math.min(cause.phi(), effect.phi());
	}
}
