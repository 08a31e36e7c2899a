package mixfix.printer;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class FreeMetavariableIssue extends DeclarationIssue {
	private final String ruleName;
	private final int index;

	public FreeMetavariableIssue(String ruleName, int index) {
		this.ruleName = ruleName;
		this.index = index;
	}

	public String getRuleName() {
		return ruleName;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
