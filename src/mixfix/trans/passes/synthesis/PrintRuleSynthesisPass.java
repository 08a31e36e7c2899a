package mixfix.trans.passes.synthesis;

import mixfix.model.notation.NotationSymbol;
import mixfix.model.notation.NotationTerminal;
import mixfix.model.notation.NotationVariable;
import mixfix.model.term.Term;
import mixfix.printer.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the printing rule of a notation: its symbols in order, separated by breaks, in one box.
 */
public class PrintRuleSynthesisPass {
	private PrintRuleSynthesisPass() {}

	public static String ruleName(String key, String scope) {
		return key + "_" + scope + "_notation";
	}

	// a break touching a letter of a terminal keeps the terminal from fusing with its neighbour
	static boolean glueProtecting(NotationSymbol before, NotationSymbol after) {
		return (before instanceof NotationTerminal && ((NotationTerminal) before).endsWithLetter()) ||
				(after instanceof NotationTerminal && ((NotationTerminal) after).startsWithLetter());
	}

	public static List<PrintHunk> hunks(List<NotationSymbol> symbols, int boxIndent) {
		List<PrintHunk> hunks = new ArrayList<>();
		NotationSymbol previous = null;
		for (NotationSymbol symbol : symbols) {
			if (previous != null) {
				hunks.add(new PrintBreak(1, 0, glueProtecting(previous, symbol)));
			}
			if (symbol instanceof NotationTerminal) {
				hunks.add(new PrintLiteral(((NotationTerminal) symbol).getText()));
			} else {
				NotationVariable variable = (NotationVariable) symbol;
				hunks.add(new PrintSubterm(variable.getIndex(), variable.getWindow()));
			}
			previous = symbol;
		}
		return Collections.singletonList(new PrintBox(boxIndent, hunks));
	}

	public static PrintRule perform(String universe, String scope, String key, int level,
	                                List<NotationSymbol> symbols, Term displayPattern, int boxIndent) {
		return new PrintRule(ruleName(key, scope), universe, level, scope, key, displayPattern,
				hunks(symbols, boxIndent));
	}
}
