package mixfix.trans.passes.synthesis;

import mixfix.grammar.*;
import mixfix.model.notation.NotationSymbol;
import mixfix.model.notation.NotationTerminal;
import mixfix.model.notation.NotationVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the production parsing a notation: each terminal becomes a token, each hole a reference to the entry of
 * its window's effective level. The production goes to the entry of the notation's own level.
 */
public class GrammarRuleSynthesisPass {
	private GrammarRuleSynthesisPass() {}

	public static GrammarCommand perform(EntryTable table, String key, int level, List<NotationSymbol> symbols) {
		List<ProductionSymbol> productionSymbols = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationTerminal) {
				productionSymbols.add(new ProductionTerminal(((NotationTerminal) symbol).getText()));
			} else {
				NotationVariable variable = (NotationVariable) symbol;
				productionSymbols.add(new ProductionNonTerminal(table.entryForWindow(variable.getWindow()),
						variable.getName()));
			}
		}
		Production production = new Production("notation " + key, productionSymbols, new NotationAction(key));
		return new GrammarCommand(table.getUniverse(), table.entryForLevel(level), EntryKind.TERM, level, production);
	}
}
