package mixfix.model.notation;

/**
 * A precedence window: a level together with how tightly a sub-term at that position must bind.
 */
public class PrecedenceLevel {
	public static final int MIN_LEVEL = 0;
	public static final int MAX_LEVEL = 10;
	public static final int PATTERN_LEVEL = 11;

	private final int level;
	private final Tightness tightness;

	public PrecedenceLevel(int level, Tightness tightness) {
		this.level = level;
		this.tightness = tightness;
	}

	public static PrecedenceLevel exact(int level) {
		return new PrecedenceLevel(level, Tightness.EXACT);
	}

	public static PrecedenceLevel loose(int level) {
		return new PrecedenceLevel(level, Tightness.LOOSE);
	}

	public int getLevel() {
		return level;
	}

	public Tightness getTightness() {
		return tightness;
	}

	/**
	 * @return the loosest level a sub-term in this window may have without being parenthesised
	 */
	public int getEffectiveLevel() {
		if (tightness == Tightness.EXACT) {
			return level;
		}
		return Math.max(level - 1, MIN_LEVEL);
	}

	@Override
	public int hashCode() {
		return 31 * level + tightness.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		PrecedenceLevel other = (PrecedenceLevel) obj;
		return level == other.level && tightness == other.tightness;
	}

	@Override
	public String toString() {
		return level + (tightness == Tightness.EXACT ? "E" : "L");
	}
}
