package mixfix.errors;

import mixfix.trans.WhileDeclaringNotation;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileDeclaringNotation whileDeclaringNotation) throws E;

}
