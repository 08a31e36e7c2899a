package mixfix.model.term;

import mixfix.library.ModuleSubstitution;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites every {@link TermReference} according to a functor instantiation. Subtrees containing no affected
 * reference are returned as-is, so an unaffected term comes back identical ({@code ==}) to the input.
 */
public class ModuleSubstitutionVisitor extends TermVisitor<Term, RuntimeException> {

	private final ModuleSubstitution substitution;

	public ModuleSubstitutionVisitor(ModuleSubstitution substitution) {
		this.substitution = substitution;
	}

	public List<Term> substituteAll(List<Term> terms) {
		List<Term> result = new ArrayList<>(terms.size());
		boolean changed = false;
		for (Term t : terms) {
			Term s = t.accept(this);
			changed |= s != t;
			result.add(s);
		}
		return changed ? result : terms;
	}

	@Override
	public Term visit(TermVariable termVariable) {
		return termVariable;
	}

	@Override
	public Term visit(TermReference termReference) {
		QualifiedName name = substitution.apply(termReference.getName());
		if (name.equals(termReference.getName())) {
			return termReference;
		}
		return new TermReference(name);
	}

	@Override
	public Term visit(TermApplication termApplication) {
		Term head = termApplication.getHead().accept(this);
		List<Term> args = substituteAll(termApplication.getArguments());
		if (head == termApplication.getHead() && args == termApplication.getArguments()) {
			return termApplication;
		}
		return new TermApplication(head, args);
	}

	@Override
	public Term visit(TermLambda termLambda) {
		Term body = termLambda.getBody().accept(this);
		return body == termLambda.getBody() ? termLambda : new TermLambda(termLambda.getBinder(), body);
	}

	@Override
	public Term visit(TermMeta termMeta) {
		return termMeta;
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
		List<Term> args = substituteAll(termNotation.getArguments());
		return args == termNotation.getArguments() ? termNotation : new TermNotation(termNotation.getKey(), args);
	}

	@Override
	public Term visit(TermDelimited termDelimited) {
		Term inner = termDelimited.getInner().accept(this);
		return inner == termDelimited.getInner() ? termDelimited :
				new TermDelimited(termDelimited.getScope(), inner);
	}
}
