package mixfix.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a notation's grammar rule produces: the notation key together with the sub-terms parsed at each hole, left
 * to right. The elaborator replaces it by the notation's interpretation.
 */
public class TermNotation extends Term {
	private final String key;
	private final List<Term> arguments;

	public TermNotation(String key, List<Term> arguments) {
		this.key = key;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getKey() {
		return key;
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
		return Objects.hash(key, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		TermNotation other = (TermNotation) obj;
		return key.equals(other.key) && arguments.equals(other.arguments);
	}
}
