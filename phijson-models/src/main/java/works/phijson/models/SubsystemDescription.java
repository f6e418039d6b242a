package works.phijson.models;

import java.util.List;
import lombok.With;

/**
 * A set of nodes of a {@link NetworkDescription network}, with the network in a given state.
 *
 * @param state one entry per node of the whole network
 */
@With
public record SubsystemDescription(
	NetworkDescription network,
	List<Integer> state,
	List<Integer> nodeIndices
) {
	public SubsystemDescription {
		state = List.copyOf(state);
		nodeIndices = List.copyOf(nodeIndices);
	}
}
