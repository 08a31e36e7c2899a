package mixfix.trans.passes.symbols;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class AdjacentHolesIssue extends DeclarationIssue {
	private final String first;
	private final String second;

	public AdjacentHolesIssue(String first, String second) {
		this.first = first;
		this.second = second;
	}

	public String getFirst() {
		return first;
	}

	public String getSecond() {
		return second;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
