package works.phijson.models;

import java.util.List;
import lombok.With;

/**
 * A partition of a mechanism and purview into {@link Part parts}.
 *
 * @param nodeLabels for display only; empty when the fixture didn't record them
 */
@With
public record KPartition(
	List<Part> parts,
	List<String> nodeLabels
) {
	public KPartition {
		parts = List.copyOf(parts);
		nodeLabels = List.copyOf(nodeLabels);
	}

	public static KPartition of(Part... parts) {
		return new KPartition(List.of(parts), List.of());
	}

	public int size() {
		return parts.size();
	}
}
