package mixfix.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexes term input against the set of currently registered tokens.
 *
 * Identifiers that are registered tokens become keywords. Other text is matched against the registered
 * symbolic tokens, longest first; an unregistered character becomes a one-character symbol and is left for the
 * parser to reject.
 */
public class TermLexer {

	static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_']*(\\.[A-Za-z_][A-Za-z0-9_']*)*");
	static final Pattern NUMBER = Pattern.compile("[0-9]+");

	private final Set<String> tokens;

	public TermLexer(Set<String> tokens) {
		this.tokens = tokens;
	}

	public List<TermToken> readTokens(CharSequence input) {
		List<TermToken> result = new ArrayList<>();
		Matcher identifier = IDENTIFIER.matcher(input);
		Matcher number = NUMBER.matcher(input);
		int pos = 0;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isWhitespace(c)) {
				++pos;
				continue;
			}
			String symbol = longestSymbolAt(input, pos);
			if (identifier.region(pos, input.length()).lookingAt()
					&& (symbol == null || identifier.end() - pos >= symbol.length())) {
				String text = identifier.group();
				TermTokenType type;
				if (tokens.contains(text)) {
					type = TermTokenType.KEYWORD;
				} else if (text.equals("_")) {
					type = TermTokenType.EVAR;
				} else {
					type = TermTokenType.IDENT;
				}
				result.add(new TermToken(text, type, pos));
				pos = identifier.end();
			} else if (symbol == null && number.region(pos, input.length()).lookingAt()) {
				result.add(new TermToken(number.group(), TermTokenType.NUMBER, pos));
				pos = number.end();
			} else if (symbol != null) {
				result.add(new TermToken(symbol, TermTokenType.SYMBOL, pos));
				pos += symbol.length();
			} else {
				result.add(new TermToken(String.valueOf(c), TermTokenType.SYMBOL, pos));
				++pos;
			}
		}
		result.add(new TermToken("", TermTokenType.EOF, input.length()));
		return result;
	}

	private String longestSymbolAt(CharSequence input, int pos) {
		String best = null;
		for (String token : tokens) {
			if (token.isEmpty() || Character.isLetter(token.charAt(0))) {
				continue;
			}
			if (pos + token.length() <= input.length()
					&& input.subSequence(pos, pos + token.length()).toString().equals(token)
					&& (best == null || token.length() > best.length())) {
				best = token;
			}
		}
		return best;
	}
}
