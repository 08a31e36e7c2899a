package mixfix.printer;

public abstract class PrintHunkVisitor<T, E extends Throwable> {
	public abstract T visit(PrintLiteral printLiteral) throws E;
	public abstract T visit(PrintBreak printBreak) throws E;
	public abstract T visit(PrintSubterm printSubterm) throws E;
	public abstract T visit(PrintBox printBox) throws E;
}
