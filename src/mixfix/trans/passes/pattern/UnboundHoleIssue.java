package mixfix.trans.passes.pattern;

import mixfix.errors.IssueVisitor;
import mixfix.errors.PatternIssue;

public class UnboundHoleIssue extends PatternIssue {
	private final String name;

	public UnboundHoleIssue(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
