package mixfix.trans.passes.symbols;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class DuplicateVariableIssue extends DeclarationIssue {
	private final String name;

	public DuplicateVariableIssue(String name) {
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
