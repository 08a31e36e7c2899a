package mixfix.grammar;

import mixfix.InternalCompilerError;
import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.Term;
import mixfix.model.term.TermDelimited;

import java.util.List;
import java.util.Objects;

public class DelimiterAction extends ProductionAction {
	private final String scope;
	private final boolean forPatterns;

	public DelimiterAction(String scope, boolean forPatterns) {
		this.scope = scope;
		this.forPatterns = forPatterns;
	}

	public String getScope() {
		return scope;
	}

	public boolean isForPatterns() {
		return forPatterns;
	}

	@Override
	public Term apply(List<Term> holes) {
		if (holes.size() != 1) {
			throw new InternalCompilerError("delimiters enclose exactly one term, got " + holes.size());
		}
		return new TermDelimited(scope, holes.get(0));
	}

	@Override
	public ProductionAction substitute(ModuleSubstitutionVisitor substitution) {
		return this;
	}

	@Override
	public int hashCode() {
		return Objects.hash(scope, forPatterns);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		DelimiterAction other = (DelimiterAction) obj;
		return forPatterns == other.forPatterns && scope.equals(other.scope);
	}

	@Override
	public String toString() {
		return (forPatterns ? "PATTDELIMITERS \"" : "DELIMITERS \"") + scope + "\"";
	}
}
