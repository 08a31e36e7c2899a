package mixfix.model.term;

import java.util.Arrays;

public class TermBuilder {
	private TermBuilder() {}

	public static TermVariable var(String name) {
		return new TermVariable(name);
	}

	public static TermReference ref(String dotted) {
		return new TermReference(QualifiedName.parse(dotted));
	}

	public static TermApplication app(Term head, Term... args) {
		return new TermApplication(head, Arrays.asList(args));
	}

	public static TermLambda lam(String binder, Term body) {
		return new TermLambda(binder, body);
	}

	public static TermMeta meta(int index) {
		return new TermMeta(index);
	}

	public static TermEvar evar() {
		return new TermEvar();
	}

	public static TermNumber num(int value) {
		return new TermNumber(Integer.toString(value));
	}

	public static TermNotation ntn(String key, Term... args) {
		return new TermNotation(key, Arrays.asList(args));
	}

	public static TermDelimited delim(String scope, Term inner) {
		return new TermDelimited(scope, inner);
	}
}
