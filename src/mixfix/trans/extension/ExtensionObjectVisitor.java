package mixfix.trans.extension;

public abstract class ExtensionObjectVisitor<T, E extends Throwable> {
	public abstract T visit(TokenObject tokenObject) throws E;
	public abstract T visit(GrammarRuleObject grammarRuleObject) throws E;
	public abstract T visit(PrintRuleObject printRuleObject) throws E;
	public abstract T visit(NotationBundle notationBundle) throws E;
	public abstract T visit(DelimiterBundle delimiterBundle) throws E;
}
