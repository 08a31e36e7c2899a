package mixfix.model.term;

import java.util.Set;

/**
 * Gathers the indices of every {@link TermMeta} occurring in a term.
 */
public class MetaCollectingVisitor extends TermVisitor<Void, RuntimeException> {

	private final Set<Integer> found;

	public MetaCollectingVisitor(Set<Integer> found) {
		this.found = found;
	}

	@Override
	public Void visit(TermVariable termVariable) {
		return null;
	}

	@Override
	public Void visit(TermReference termReference) {
		return null;
	}

	@Override
	public Void visit(TermApplication termApplication) {
		termApplication.getHead().accept(this);
		for (Term arg : termApplication.getArguments()) {
			arg.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(TermLambda termLambda) {
		return termLambda.getBody().accept(this);
	}

	@Override
	public Void visit(TermMeta termMeta) {
		found.add(termMeta.getIndex());
		return null;
	}

	@Override
	public Void visit(TermEvar termEvar) {
		return null;
	}

	@Override
	public Void visit(TermNumber termNumber) {
		return null;
	}

	@Override
	public Void visit(TermNotation termNotation) {
		for (Term arg : termNotation.getArguments()) {
			arg.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(TermDelimited termDelimited) {
		return termDelimited.getInner().accept(this);
	}
}
