package works.phijson.models;

import java.util.List;
import lombok.With;
import works.phijson.array.NumericArray;

/**
 * The irreducibility of a whole subsystem in some state, under its minimal {@link Cut}.
 */
@With
public record SystemIrreducibilityAnalysis(
	double phi,
	List<Integer> nodeIndices,
	List<Integer> currentState,
	Cut partition,
	NumericArray causeRepertoire,
	NumericArray effectRepertoire
) {
	public SystemIrreducibilityAnalysis {
		nodeIndices = List.copyOf(nodeIndices);
		currentState = List.copyOf(currentState);
	}
}
