package mixfix.trans.passes.pattern;

import mixfix.errors.IssueVisitor;
import mixfix.errors.PatternIssue;
import mixfix.model.term.Term;

public class UnexpectedBoundFormIssue extends PatternIssue {
	private final Term term;

	public UnexpectedBoundFormIssue(Term term) {
		this.term = term;
	}

	public Term getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
