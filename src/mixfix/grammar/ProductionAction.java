package mixfix.grammar;

import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.Term;

import java.util.List;

/**
 * The semantic action of a production: builds a term from the sub-terms parsed at its non-terminals.
 */
public abstract class ProductionAction {

	public abstract Term apply(List<Term> holes);

	/**
	 * @return this action with its resolved references rewritten, or this very instance if none change
	 */
	public abstract ProductionAction substitute(ModuleSubstitutionVisitor substitution);

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);
}
