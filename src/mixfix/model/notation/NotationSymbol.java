package mixfix.model.notation;

/**
 * One compiled token of a notation's format.
 */
public abstract class NotationSymbol {

	/**
	 * @return how this symbol appears in the notation key
	 */
	public abstract String getKeyText();

	public abstract <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);
}
