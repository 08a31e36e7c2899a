package mixfix.scope;

import mixfix.errors.Issue;
import mixfix.errors.IssueVisitor;

import java.util.List;

public class UnknownNotationIssue extends Issue {
	private final String key;
	private final List<String> scopes;

	public UnknownNotationIssue(String key, List<String> scopes) {
		this.key = key;
		this.scopes = scopes;
	}

	public String getKey() {
		return key;
	}

	/**
	 * @return the scopes that were searched, innermost first
	 */
	public List<String> getScopes() {
		return scopes;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
