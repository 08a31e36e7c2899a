package mixfix.grammar;

public abstract class ProductionSymbol {

	public abstract <T, E extends Throwable> T accept(ProductionSymbolVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);
}
