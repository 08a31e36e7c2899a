package mixfix.model.term;

/**
 * A resolved reference to a global constant. These are the only nodes rewritten by module substitution.
 */
public class TermReference extends Term {
	private final QualifiedName name;

	public TermReference(QualifiedName name) {
		this.name = name;
	}

	public QualifiedName getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 + name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return name.equals(((TermReference) obj).name);
	}
}
