package mixfix.trans.passes.pattern;

import mixfix.errors.IssueVisitor;
import mixfix.errors.PatternIssue;
import mixfix.model.term.TermMeta;

public class UnexpectedMetavariableIssue extends PatternIssue {
	private final TermMeta meta;

	public UnexpectedMetavariableIssue(TermMeta meta) {
		this.meta = meta;
	}

	public TermMeta getMeta() {
		return meta;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
