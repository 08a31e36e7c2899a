package mixfix.model.term;

import mixfix.InternalCompilerError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Instantiates a macro pattern: every {@code $eN} is replaced by the N-th sub-term. Use {@link #instantiate} rather
 * than visiting directly, so that the arguments are checked to be consumed.
 */
public class PatternInstantiationVisitor extends TermVisitor<Term, RuntimeException> {

	private final List<Term> arguments;
	private final Set<Integer> used;

	private PatternInstantiationVisitor(List<Term> arguments) {
		this.arguments = arguments;
		this.used = new HashSet<>();
	}

	public static Term instantiate(Term pattern, List<Term> arguments) {
		PatternInstantiationVisitor v = new PatternInstantiationVisitor(arguments);
		Term result = pattern.accept(v);
		if (v.used.size() != arguments.size()) {
			throw new InternalCompilerError("pattern " + pattern + " consumed " + v.used.size() + " of " +
					arguments.size() + " sub-terms");
		}
		return result;
	}

	private List<Term> instantiateAll(List<Term> terms) {
		List<Term> result = new ArrayList<>(terms.size());
		for (Term t : terms) {
			result.add(t.accept(this));
		}
		return result;
	}

	@Override
	public Term visit(TermVariable termVariable) {
		return termVariable;
	}

	@Override
	public Term visit(TermReference termReference) {
		return termReference;
	}

	@Override
	public Term visit(TermApplication termApplication) {
		return new TermApplication(termApplication.getHead().accept(this),
				instantiateAll(termApplication.getArguments()));
	}

	@Override
	public Term visit(TermLambda termLambda) {
		return new TermLambda(termLambda.getBinder(), termLambda.getBody().accept(this));
	}

	@Override
	public Term visit(TermMeta termMeta) {
		int index = termMeta.getIndex();
		if (index < 1 || index > arguments.size()) {
			throw new InternalCompilerError("no sub-term for $e" + index);
		}
		used.add(index);
		return arguments.get(index - 1);
	}

	@Override
	public Term visit(TermEvar termEvar) {
		return termEvar;
	}

	@Override
	public Term visit(TermNumber termNumber) {
		return termNumber;
	}

	@Override
	public Term visit(TermNotation termNotation) {
		return new TermNotation(termNotation.getKey(), instantiateAll(termNotation.getArguments()));
	}

	@Override
	public Term visit(TermDelimited termDelimited) {
		return new TermDelimited(termDelimited.getScope(), termDelimited.getInner().accept(this));
	}
}
