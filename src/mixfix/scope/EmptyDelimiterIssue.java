package mixfix.scope;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class EmptyDelimiterIssue extends DeclarationIssue {
	private final String scope;

	public EmptyDelimiterIssue(String scope) {
		this.scope = scope;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
