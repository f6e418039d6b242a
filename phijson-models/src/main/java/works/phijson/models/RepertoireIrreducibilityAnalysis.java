package works.phijson.models;

import java.util.List;
import lombok.With;
import works.phijson.array.NumericArray;

/**
 * The irreducibility of one mechanism's cause or effect repertoire over a purview,
 * measured against its minimum-information partition.
 *
 * @param specifiedState the purview state the mechanism specifies; empty in fixtures from format 1.0
 */
@With
public record RepertoireIrreducibilityAnalysis(
	double phi,
	Direction direction,
	List<Integer> mechanism,
	List<Integer> purview,
	KPartition partition,
	NumericArray repertoire,
	NumericArray partitionedRepertoire,
	List<Integer> specifiedState
) {
	public RepertoireIrreducibilityAnalysis {
		mechanism = List.copyOf(mechanism);
		purview = List.copyOf(purview);
		specifiedState = List.copyOf(specifiedState);
	}
}
