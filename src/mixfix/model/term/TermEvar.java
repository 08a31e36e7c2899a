package mixfix.model.term;

/**
 * An existential placeholder, written {@code _} or inserted for an implicit argument.
 */
public class TermEvar extends Term {

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 17;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
