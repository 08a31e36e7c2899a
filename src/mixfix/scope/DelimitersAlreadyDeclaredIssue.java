package mixfix.scope;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;
import mixfix.model.notation.DelimiterPair;

public class DelimitersAlreadyDeclaredIssue extends DeclarationIssue {
	private final String scope;
	private final DelimiterPair existing;
	private final DelimiterPair requested;

	public DelimitersAlreadyDeclaredIssue(String scope, DelimiterPair existing, DelimiterPair requested) {
		this.scope = scope;
		this.existing = existing;
		this.requested = requested;
	}

	public String getScope() {
		return scope;
	}

	public DelimiterPair getExisting() {
		return existing;
	}

	public DelimiterPair getRequested() {
		return requested;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
