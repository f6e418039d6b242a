package works.phijson.models;

import java.util.List;

/**
 * Stands in for a {@link SystemIrreducibilityAnalysis} when the subsystem is
 * trivially reducible, so there is nothing to analyze.
 */
public record NullSystemIrreducibilityAnalysis(List<Integer> nodeIndices) {
	public NullSystemIrreducibilityAnalysis {
		nodeIndices = List.copyOf(nodeIndices);
	}

	public double phi() {
		return 0.0;
	}
}
