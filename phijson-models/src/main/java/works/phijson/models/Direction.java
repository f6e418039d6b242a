package works.phijson.models;

/**
 * Whether an analysis looks at a mechanism's causes (the past)
 * or its effects (the future).
 */
public enum Direction {
	CAUSE,
	EFFECT;

	public Direction opposite() {
		return (this == CAUSE) ? EFFECT : CAUSE;
	}
}
