package mixfix.model.term;

import java.util.Collections;
import java.util.List;

/**
 *
 * AST Node:
 *
 * head arg1 arg2 ... argN
 *
 */
public class TermApplication extends Term {
	private final Term head;
	private final List<Term> arguments;

	public TermApplication(Term head, List<Term> arguments) {
		this.head = head;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public Term getHead() {
		return head;
	}

	public List<Term> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((arguments == null) ? 0 : arguments.hashCode());
		result = prime * result + ((head == null) ? 0 : head.hashCode());
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
		TermApplication other = (TermApplication) obj;
		if (arguments == null) {
			if (other.arguments != null)
				return false;
		} else if (!arguments.equals(other.arguments))
			return false;
		if (head == null) {
			return other.head == null;
		} else return head.equals(other.head);
	}
}
