package mixfix.model.term;

import java.util.Objects;

/**
 * A term written between the delimiters of a scope; its notations are interpreted in that scope first.
 */
public class TermDelimited extends Term {
	private final String scope;
	private final Term inner;

	public TermDelimited(String scope, Term inner) {
		this.scope = scope;
		this.inner = inner;
	}

	public String getScope() {
		return scope;
	}

	public Term getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scope, inner);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TermDelimited other = (TermDelimited) obj;
		return scope.equals(other.scope) && inner.equals(other.inner);
	}
}
