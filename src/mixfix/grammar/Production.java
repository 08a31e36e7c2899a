package mixfix.grammar;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Production {
	private final String name;
	private final List<ProductionSymbol> symbols;
	private final ProductionAction action;

	public Production(String name, List<ProductionSymbol> symbols, ProductionAction action) {
		this.name = name;
		this.symbols = Collections.unmodifiableList(symbols);
		this.action = action;
	}

	public String getName() {
		return name;
	}

	public List<ProductionSymbol> getSymbols() {
		return symbols;
	}

	public ProductionAction getAction() {
		return action;
	}

	public Production withAction(ProductionAction action) {
		return action == this.action ? this : new Production(name, symbols, action);
	}

	/**
	 * @return whether the production starts with a non-terminal, i.e. extends an already parsed left operand
	 */
	public boolean isLeftRecursive() {
		return !symbols.isEmpty() && symbols.get(0) instanceof ProductionNonTerminal;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, symbols, action);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Production other = (Production) obj;
		return name.equals(other.name) && symbols.equals(other.symbols) && action.equals(other.action);
	}

	@Override
	public String toString() {
		return name + ": " + symbols + " -> " + action;
	}
}
