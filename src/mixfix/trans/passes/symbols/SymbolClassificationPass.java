package mixfix.trans.passes.symbols;

import mixfix.errors.IssueContext;
import mixfix.model.notation.*;
import mixfix.trans.PrecedenceRangeIssue;

import java.util.*;
import java.util.logging.Logger;

/**
 * <p>
 * Turns the raw tokens of a format into notation symbols and gives every hole its precedence window.
 * </p>
 *
 * <p>
 * A token starting with a letter is a hole; any other token is a terminal, with one pair of enclosing single
 * quotes removed. With {@code n} the notation's level, the outer holes get the windows of the associativity:
 * </p>
 * <ul>
 *     <li>left (and unspecified): {@code nE} on the left, {@code nL} on the right</li>
 *     <li>right: {@code nL} on the left, {@code nE} on the right</li>
 *     <li>none: {@code nL} on both sides</li>
 * </ul>
 * <p>
 * A hole that is closed by a later terminal and is not the first token can hold anything, {@code 10E}. A pinned
 * level always wins.
 * </p>
 */
public class SymbolClassificationPass {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	private SymbolClassificationPass() {}

	public static boolean isVariableToken(String token) {
		return !token.isEmpty() && Character.isLetter(token.charAt(0));
	}

	public static String unquote(String token) {
		if (token.length() > 2 && token.charAt(0) == '\'' && token.charAt(token.length() - 1) == '\'') {
			return token.substring(1, token.length() - 1);
		}
		return token;
	}

	/**
	 * @return the windows of the leftmost and the rightmost hole, in that order
	 */
	public static List<PrecedenceLevel> outerWindows(int level, Associativity associativity) {
		switch (associativity) {
			case RIGHT:
				return Arrays.asList(PrecedenceLevel.loose(level), PrecedenceLevel.exact(level));
			case NONE:
				return Arrays.asList(PrecedenceLevel.loose(level), PrecedenceLevel.loose(level));
			case LEFT:
			case UNSPECIFIED:
				return Arrays.asList(PrecedenceLevel.exact(level), PrecedenceLevel.loose(level));
			default:
				throw new IllegalArgumentException("unknown associativity " + associativity);
		}
	}

	public static List<NotationSymbol> perform(IssueContext ctx, List<String> tokens, int level,
	                                           Associativity associativity, Map<String, Integer> pinned) {
		List<PrecedenceLevel> outer = outerWindows(level, associativity);
		Set<String> names = new HashSet<>();
		for (String token : tokens) {
			if (isVariableToken(token)) {
				names.add(token);
			}
		}
		for (Map.Entry<String, Integer> entry : pinned.entrySet()) {
			if (!names.contains(entry.getKey())) {
				logger.warning("ignoring precedence given for " + entry.getKey() +
						", which is not a hole of the notation");
			} else if (entry.getValue() < PrecedenceLevel.MIN_LEVEL || entry.getValue() > PrecedenceLevel.MAX_LEVEL) {
				ctx.error(new PrecedenceRangeIssue(entry.getValue(), PrecedenceLevel.MIN_LEVEL,
						PrecedenceLevel.MAX_LEVEL));
			}
		}

		List<NotationSymbol> symbols = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		String previousHole = null;
		int index = 1;
		for (int i = 0; i < tokens.size(); ++i) {
			String token = tokens.get(i);
			if (!isVariableToken(token)) {
				symbols.add(new NotationTerminal(unquote(token)));
				previousHole = null;
				continue;
			}
			if (!seen.add(token)) {
				ctx.error(new DuplicateVariableIssue(token));
			}
			if (previousHole != null) {
				ctx.error(new AdjacentHolesIssue(previousHole, token));
			}
			previousHole = token;
			boolean terminalLater = false;
			for (int j = i + 1; j < tokens.size(); ++j) {
				if (!isVariableToken(tokens.get(j))) {
					terminalLater = true;
					break;
				}
			}
			PrecedenceLevel window;
			if (pinned.containsKey(token) && pinned.get(token) >= PrecedenceLevel.MIN_LEVEL &&
					pinned.get(token) <= PrecedenceLevel.MAX_LEVEL) {
				window = PrecedenceLevel.exact(pinned.get(token));
			} else if (i == 0) {
				window = terminalLater ? outer.get(0) : outer.get(1);
			} else if (terminalLater) {
				window = PrecedenceLevel.exact(PrecedenceLevel.MAX_LEVEL);
			} else {
				window = outer.get(1);
			}
			symbols.add(new NotationVariable(token, window, index));
			++index;
		}
		return symbols;
	}

	/**
	 * @return the key identifying the notation's shape, e.g. {@code _ + _}
	 */
	public static String notationKey(List<NotationSymbol> symbols) {
		List<String> parts = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			parts.add(symbol.getKeyText());
		}
		return String.join(" ", parts);
	}

	public static NotationPrecedence precedence(int level, Associativity associativity,
	                                            List<NotationSymbol> symbols) {
		List<Integer> holeLevels = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationVariable) {
				holeLevels.add(((NotationVariable) symbol).getWindow().getEffectiveLevel());
			}
		}
		return new NotationPrecedence(level, holeLevels, associativity);
	}

	public static List<NotationVariable> holes(List<NotationSymbol> symbols) {
		List<NotationVariable> result = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationVariable) {
				result.add((NotationVariable) symbol);
			}
		}
		return result;
	}
}
