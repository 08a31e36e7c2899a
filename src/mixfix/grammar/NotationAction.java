package mixfix.grammar;

import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.Term;
import mixfix.model.term.TermNotation;

import java.util.List;

public class NotationAction extends ProductionAction {
	private final String key;

	public NotationAction(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	@Override
	public Term apply(List<Term> holes) {
		return new TermNotation(key, holes);
	}

	@Override
	public ProductionAction substitute(ModuleSubstitutionVisitor substitution) {
		return this;
	}

	@Override
	public int hashCode() {
		return key.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return key.equals(((NotationAction) obj).key);
	}

	@Override
	public String toString() {
		return "NOTATION \"" + key + "\"";
	}
}
