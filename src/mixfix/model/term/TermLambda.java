package mixfix.model.term;

import java.util.Objects;

/**
 *
 * AST Node:
 *
 * fun binder => body
 *
 */
public class TermLambda extends Term {
	private final String binder;
	private final Term body;

	public TermLambda(String binder, Term body) {
		this.binder = binder;
		this.body = body;
	}

	public String getBinder() {
		return binder;
	}

	public Term getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(binder, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TermLambda other = (TermLambda) obj;
		return Objects.equals(binder, other.binder) && Objects.equals(body, other.body);
	}
}
