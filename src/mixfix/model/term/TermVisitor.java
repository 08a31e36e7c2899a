package mixfix.model.term;

public abstract class TermVisitor<T, E extends Throwable> {
	public abstract T visit(TermVariable termVariable) throws E;
	public abstract T visit(TermReference termReference) throws E;
	public abstract T visit(TermApplication termApplication) throws E;
	public abstract T visit(TermLambda termLambda) throws E;
	public abstract T visit(TermMeta termMeta) throws E;
	public abstract T visit(TermEvar termEvar) throws E;
	public abstract T visit(TermNumber termNumber) throws E;
	public abstract T visit(TermNotation termNotation) throws E;
	public abstract T visit(TermDelimited termDelimited) throws E;
}
