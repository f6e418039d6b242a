package works.phijson.models;

import java.util.List;
import lombok.With;

/**
 * One piece of a {@link KPartition}: a subset of a mechanism paired with a subset of its purview.
 * Either side may be empty.
 */
@With
public record Part(
	List<Integer> mechanism,
	List<Integer> purview
) {
	public Part {
		mechanism = List.copyOf(mechanism);
		purview = List.copyOf(purview);
	}
}
