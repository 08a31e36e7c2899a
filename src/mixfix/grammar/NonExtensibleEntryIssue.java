package mixfix.grammar;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;

public class NonExtensibleEntryIssue extends DeclarationIssue {
	private final String universe;
	private final String entry;
	private final EntryKind kind;

	public NonExtensibleEntryIssue(String universe, String entry, EntryKind kind) {
		this.universe = universe;
		this.entry = entry;
		this.kind = kind;
	}

	public String getUniverse() {
		return universe;
	}

	public String getEntry() {
		return entry;
	}

	public EntryKind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
