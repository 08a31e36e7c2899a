package mixfix.printer;

/**
 * One directive of a printing rule, or one node of a laid-out term.
 */
public abstract class PrintHunk {

	public abstract <T, E extends Throwable> T accept(PrintHunkVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);
}
