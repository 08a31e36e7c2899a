package mixfix.grammar;

import java.util.Objects;

/**
 * A reference to the entry a hole is parsed with. The variable is the hole's name, kept for grammar printing.
 */
public class ProductionNonTerminal extends ProductionSymbol {
	private final String entry;
	private final String variable;

	public ProductionNonTerminal(String entry, String variable) {
		this.entry = entry;
		this.variable = variable;
	}

	public String getEntry() {
		return entry;
	}

	public String getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(ProductionSymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entry, variable);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ProductionNonTerminal other = (ProductionNonTerminal) obj;
		return entry.equals(other.entry) && Objects.equals(variable, other.variable);
	}

	@Override
	public String toString() {
		return variable == null ? entry : entry + "(" + variable + ")";
	}
}
