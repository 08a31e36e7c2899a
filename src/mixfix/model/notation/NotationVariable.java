package mixfix.model.notation;

import java.util.Objects;

/**
 * A hole of a notation, with the precedence window its sub-term is parsed and printed at. Holes are numbered
 * from 1, left to right; the number is the index of the {@link mixfix.model.term.TermMeta} standing for it.
 */
public class NotationVariable extends NotationSymbol {
	private final String name;
	private final PrecedenceLevel window;
	private final int index;

	public NotationVariable(String name, PrecedenceLevel window, int index) {
		this.name = name;
		this.window = window;
		this.index = index;
	}

	public String getName() {
		return name;
	}

	public PrecedenceLevel getWindow() {
		return window;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public String getKeyText() {
		return "_";
	}

	@Override
	public <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, window, index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NotationVariable other = (NotationVariable) obj;
		return index == other.index && name.equals(other.name) && window.equals(other.window);
	}

	@Override
	public String toString() {
		return name + ":" + window;
	}
}
