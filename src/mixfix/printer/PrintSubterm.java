package mixfix.printer;

import mixfix.model.notation.PrecedenceLevel;

import java.util.Objects;

/**
 * Prints the sub-term bound to {@code $eN}, in parentheses if it binds more loosely than the window allows.
 */
public class PrintSubterm extends PrintHunk {
	private final int index;
	private final PrecedenceLevel window;

	public PrintSubterm(int index, PrecedenceLevel window) {
		this.index = index;
		this.window = window;
	}

	public int getIndex() {
		return index;
	}

	public PrecedenceLevel getWindow() {
		return window;
	}

	@Override
	public <T, E extends Throwable> T accept(PrintHunkVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, window);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		PrintSubterm other = (PrintSubterm) obj;
		return index == other.index && window.equals(other.window);
	}

	@Override
	public String toString() {
		return "$e" + index + ":" + window;
	}
}
