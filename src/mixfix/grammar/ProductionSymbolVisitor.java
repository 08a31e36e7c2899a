package mixfix.grammar;

public abstract class ProductionSymbolVisitor<T, E extends Throwable> {
	public abstract T visit(ProductionTerminal productionTerminal) throws E;
	public abstract T visit(ProductionNonTerminal productionNonTerminal) throws E;
}
