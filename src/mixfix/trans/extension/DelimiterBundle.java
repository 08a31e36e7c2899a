package mixfix.trans.extension;

import mixfix.grammar.GrammarCommand;
import mixfix.model.notation.DelimiterPair;

import java.util.Objects;

/**
 * A scope's delimiters, with the rules that parse them around terms and around patterns.
 */
public class DelimiterBundle extends ExtensionObject {
	private final String scope;
	private final DelimiterPair delimiters;
	private final GrammarCommand termRule;
	private final GrammarCommand patternRule;

	public DelimiterBundle(String scope, DelimiterPair delimiters, GrammarCommand termRule,
	                       GrammarCommand patternRule) {
		this.scope = scope;
		this.delimiters = delimiters;
		this.termRule = termRule;
		this.patternRule = patternRule;
	}

	public String getScope() {
		return scope;
	}

	public DelimiterPair getDelimiters() {
		return delimiters;
	}

	public GrammarCommand getTermRule() {
		return termRule;
	}

	public GrammarCommand getPatternRule() {
		return patternRule;
	}

	@Override
	public <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scope, delimiters, termRule, patternRule);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		DelimiterBundle other = (DelimiterBundle) obj;
		return scope.equals(other.scope) && delimiters.equals(other.delimiters) &&
				termRule.equals(other.termRule) && patternRule.equals(other.patternRule);
	}

	@Override
	public String toString() {
		return "delimiters " + delimiters + " for " + scope;
	}
}
