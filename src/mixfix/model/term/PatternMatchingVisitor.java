package mixfix.model.term;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches a display pattern against a term. Each {@code $eN} binds the sub-term at its position, consistently
 * across repeated occurrences; {@code _} matches anything. Use {@link #match}.
 */
public class PatternMatchingVisitor extends TermVisitor<Boolean, RuntimeException> {

	private final Map<Integer, Term> bindings;
	private Term target;

	private PatternMatchingVisitor() {
		this.bindings = new HashMap<>();
	}

	public static Optional<Map<Integer, Term>> match(Term pattern, Term term) {
		PatternMatchingVisitor v = new PatternMatchingVisitor();
		if (v.matches(pattern, term)) {
			return Optional.of(v.bindings);
		}
		return Optional.empty();
	}

	private boolean matches(Term pattern, Term term) {
		Term saved = target;
		target = term;
		try {
			return pattern.accept(this);
		} finally {
			target = saved;
		}
	}

	private boolean matchesAll(List<Term> patterns, List<Term> terms) {
		if (patterns.size() != terms.size()) {
			return false;
		}
		for (int i = 0; i < patterns.size(); ++i) {
			if (!matches(patterns.get(i), terms.get(i))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Boolean visit(TermVariable termVariable) {
		return termVariable.equals(target);
	}

	@Override
	public Boolean visit(TermReference termReference) {
		return termReference.equals(target);
	}

	@Override
	public Boolean visit(TermApplication termApplication) {
		if (!(target instanceof TermApplication)) {
			return false;
		}
		TermApplication other = (TermApplication) target;
		return matches(termApplication.getHead(), other.getHead()) &&
				matchesAll(termApplication.getArguments(), other.getArguments());
	}

	@Override
	public Boolean visit(TermLambda termLambda) {
		if (!(target instanceof TermLambda)) {
			return false;
		}
		TermLambda other = (TermLambda) target;
		return termLambda.getBinder().equals(other.getBinder()) && matches(termLambda.getBody(), other.getBody());
	}

	@Override
	public Boolean visit(TermMeta termMeta) {
		Term bound = bindings.get(termMeta.getIndex());
		if (bound == null) {
			bindings.put(termMeta.getIndex(), target);
			return true;
		}
		return bound.equals(target);
	}

	@Override
	public Boolean visit(TermEvar termEvar) {
		return true;
	}

	@Override
	public Boolean visit(TermNumber termNumber) {
		return termNumber.equals(target);
	}

	@Override
	public Boolean visit(TermNotation termNotation) {
		if (!(target instanceof TermNotation)) {
			return false;
		}
		TermNotation other = (TermNotation) target;
		return termNotation.getKey().equals(other.getKey()) &&
				matchesAll(termNotation.getArguments(), other.getArguments());
	}

	@Override
	public Boolean visit(TermDelimited termDelimited) {
		if (!(target instanceof TermDelimited)) {
			return false;
		}
		TermDelimited other = (TermDelimited) target;
		return termDelimited.getScope().equals(other.getScope()) &&
				matches(termDelimited.getInner(), other.getInner());
	}
}
