package mixfix.model.term;

/**
 * An identifier as written by the user, or a locally bound name once elaborated.
 */
public class TermVariable extends Term {
	private final String name;

	public TermVariable(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TermVariable other = (TermVariable) obj;
		if (name == null) {
			return other.name == null;
		} else return name.equals(other.name);
	}
}
