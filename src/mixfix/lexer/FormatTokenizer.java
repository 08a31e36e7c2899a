package mixfix.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a notation format such as {@code x '+' y} into its raw tokens. Tokens are separated by spaces; runs of
 * spaces produce no empty tokens. No other quoting or escaping is interpreted here.
 */
public class FormatTokenizer {

	private FormatTokenizer() {}

	public static List<String> split(String format) {
		List<String> tokens = new ArrayList<>();
		int begin = 0;
		for (int i = 0; i < format.length(); ++i) {
			if (format.charAt(i) == ' ') {
				if (begin != i) {
					tokens.add(format.substring(begin, i));
				}
				begin = i + 1;
			}
		}
		if (begin < format.length()) {
			tokens.add(format.substring(begin));
		}
		return tokens;
	}

	public static String join(List<String> tokens) {
		return String.join(" ", tokens);
	}
}
