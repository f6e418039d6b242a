package works.phijson.models;

import java.util.List;
import lombok.With;
import works.phijson.array.NumericArray;

/**
 * The transition probability matrix and wiring of a network of binary nodes.
 */
@With
public record NetworkDescription(
	NumericArray tpm,
	NumericArray connectivityMatrix,
	List<String> nodeLabels
) {
	public NetworkDescription {
		nodeLabels = List.copyOf(nodeLabels);
		if (connectivityMatrix.rank() != 2 || !connectivityMatrix.shape().get(0).equals(connectivityMatrix.shape().get(1))) {
			throw new IllegalArgumentException("Connectivity matrix must be square; shape is " + connectivityMatrix.shape());
		}
	}

	public int size() {
		return connectivityMatrix.shape().get(0);
	}
}
