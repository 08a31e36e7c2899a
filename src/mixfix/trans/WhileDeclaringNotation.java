package mixfix.trans;

import mixfix.errors.Context;
import mixfix.errors.ContextVisitor;

public class WhileDeclaringNotation extends Context {
	private final String kind;
	private final String format;

	public WhileDeclaringNotation(String kind, String format) {
		this.kind = kind;
		this.format = format;
	}

	public String getKind() {
		return kind;
	}

	public String getFormat() {
		return format;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
