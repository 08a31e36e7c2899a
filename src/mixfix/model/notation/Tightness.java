package mixfix.model.notation;

public enum Tightness {
	/**
	 * A sub-term may sit at the window's own level.
	 */
	EXACT,
	/**
	 * A sub-term must be at least one level tighter than the window.
	 */
	LOOSE,
}
