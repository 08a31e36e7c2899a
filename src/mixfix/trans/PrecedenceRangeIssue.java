package mixfix.trans;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class PrecedenceRangeIssue extends DeclarationIssue {
	private final int level;
	private final int min;
	private final int max;

	public PrecedenceRangeIssue(int level, int min, int max) {
		this.level = level;
		this.min = min;
		this.max = max;
	}

	public int getLevel() {
		return level;
	}

	public int getMin() {
		return min;
	}

	public int getMax() {
		return max;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
