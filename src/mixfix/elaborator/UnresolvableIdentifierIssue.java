package mixfix.elaborator;

import mixfix.errors.DeclarationIssue;
import mixfix.errors.IssueVisitor;
import mixfix.model.term.QualifiedName;

import java.util.List;

/**
 * An identifier naming no constant, or naming several with none preferred. The candidates are empty in the first
 * case.
 */
public class UnresolvableIdentifierIssue extends DeclarationIssue {
	private final String name;
	private final List<QualifiedName> candidates;

	public UnresolvableIdentifierIssue(String name, List<QualifiedName> candidates) {
		this.name = name;
		this.candidates = candidates;
	}

	public String getName() {
		return name;
	}

	public List<QualifiedName> getCandidates() {
		return candidates;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
