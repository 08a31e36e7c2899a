package mixfix.grammar;

import mixfix.errors.Issue;
import mixfix.errors.IssueVisitor;

public class ParsingIssue extends Issue {
	private final String input;
	private final ParsingError error;

	public ParsingIssue(String input, ParsingError error) {
		initCause(error);
		this.input = input;
		this.error = error;
	}

	public String getInput() {
		return input;
	}

	public ParsingError getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
