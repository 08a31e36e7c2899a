package mixfix.model.term;

/**
 * The placeholder for the hole at a given (1-based) position of a notation.
 */
public class TermMeta extends Term {
	private final int index;

	public TermMeta(int index) {
		this.index = index;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 + index;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return index == ((TermMeta) obj).index;
	}
}
