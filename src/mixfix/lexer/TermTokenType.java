package mixfix.lexer;

public enum TermTokenType {
	IDENT,
	NUMBER,
	EVAR,
	KEYWORD,
	SYMBOL,
	EOF,
}
