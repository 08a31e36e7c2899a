package mixfix.elaborator;

import mixfix.model.term.Term;

import java.util.List;

/**
 * Turns surface terms into resolved ones, and resolved ones back into the shape they are displayed in.
 */
public interface Elaborator {

	/**
	 * Resolves identifiers against {@code env}, treating {@code localNames} as bound variables, inserts implicit
	 * arguments and expands notation and delimiter nodes.
	 *
	 * @throws UnresolvableIdentifierIssue on an unknown or ambiguous global name
	 * @throws mixfix.scope.UnknownNotationIssue on a notation no open scope interprets
	 */
	Term elaborate(GlobalEnvironment env, List<String> localNames, Term term);

	/**
	 * Drops what elaboration inserted, e.g. implicit arguments. {@code $eN} placeholders are kept.
	 */
	Term reify(GlobalEnvironment env, Term resolved);
}
