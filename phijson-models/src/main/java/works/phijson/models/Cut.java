package works.phijson.models;

import java.util.List;
import java.util.TreeSet;
import lombok.With;
import works.phijson.array.NumericArray;

/**
 * A unidirectional cut: connections from {@link #fromNodes} to {@link #toNodes} are severed.
 */
@With
public record Cut(
	List<Integer> fromNodes,
	List<Integer> toNodes
) {
	public Cut {
		fromNodes = List.copyOf(fromNodes);
		toNodes = List.copyOf(toNodes);
	}

	/**
	 * @return every node on either side of the cut, ascending
	 */
	public List<Integer> indices() {
		TreeSet<Integer> result = new TreeSet<>(fromNodes);
		result.addAll(toNodes);
		return List.copyOf(result);
	}

	/**
	 * @return an {@code n}-by-{@code n} int64 matrix with a 1 at {@code [i, j]}
	 * for every severed connection from node {@code i} to node {@code j}
	 * @throws IllegalArgumentException if a node index isn't less than {@code n}
	 */
	public NumericArray cutMatrix(int n) {
		long[] data = new long[n * n];
		for (int i : fromNodes) {
			for (int j : toNodes) {
				if (i >= n || j >= n) {
					throw new IllegalArgumentException("Cut " + this + " doesn't fit in " + n + " nodes");
				}
				data[i * n + j] = 1;
			}
		}
		return NumericArray.ofLongs(new int[]{n, n}, data);
	}
}
