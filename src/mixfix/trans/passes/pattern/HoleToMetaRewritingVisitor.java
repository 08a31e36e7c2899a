package mixfix.trans.passes.pattern;

import mixfix.model.term.*;

import java.util.*;

/**
 * Replaces each free occurrence of a hole's name by the hole's {@code $eN}. An abstraction binding the same name
 * hides the hole in its body.
 */
public class HoleToMetaRewritingVisitor extends TermVisitor<Term, RuntimeException> {

	private final Map<String, Integer> holes;
	private final Deque<String> bound;
	private final Set<String> used;

	public HoleToMetaRewritingVisitor(Map<String, Integer> holes) {
		this.holes = holes;
		this.bound = new ArrayDeque<>();
		this.used = new HashSet<>();
	}

	public Set<String> getUsed() {
		return used;
	}

	private List<Term> rewriteAll(List<Term> terms) {
		List<Term> result = new ArrayList<>(terms.size());
		for (Term t : terms) {
			result.add(t.accept(this));
		}
		return result;
	}

	@Override
	public Term visit(TermVariable termVariable) {
		String name = termVariable.getName();
		if (holes.containsKey(name) && !bound.contains(name)) {
			used.add(name);
			return new TermMeta(holes.get(name));
		}
		return termVariable;
	}

	@Override
	public Term visit(TermReference termReference) {
		return termReference;
	}

	@Override
	public Term visit(TermApplication termApplication) {
		return new TermApplication(termApplication.getHead().accept(this),
				rewriteAll(termApplication.getArguments()));
	}

	@Override
	public Term visit(TermLambda termLambda) {
		bound.push(termLambda.getBinder());
		try {
			return new TermLambda(termLambda.getBinder(), termLambda.getBody().accept(this));
		} finally {
			bound.pop();
		}
	}

	@Override
	public Term visit(TermMeta termMeta) {
		throw new UnexpectedBoundFormIssue(termMeta);
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
		return new TermNotation(termNotation.getKey(), rewriteAll(termNotation.getArguments()));
	}

	@Override
	public Term visit(TermDelimited termDelimited) {
		return new TermDelimited(termDelimited.getScope(), termDelimited.getInner().accept(this));
	}
}
