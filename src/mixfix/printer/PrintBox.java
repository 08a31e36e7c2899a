package mixfix.printer;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A horizontal-or-vertical box: its breaks are either all blanks or all line breaks, continuation lines being
 * indented by {@code indent} relative to the box's first column.
 */
public class PrintBox extends PrintHunk {
	private final int indent;
	private final List<PrintHunk> hunks;

	public PrintBox(int indent, List<PrintHunk> hunks) {
		this.indent = indent;
		this.hunks = Collections.unmodifiableList(hunks);
	}

	public int getIndent() {
		return indent;
	}

	public List<PrintHunk> getHunks() {
		return hunks;
	}

	@Override
	public <T, E extends Throwable> T accept(PrintHunkVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(indent, hunks);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		PrintBox other = (PrintBox) obj;
		return indent == other.indent && hunks.equals(other.hunks);
	}

	@Override
	public String toString() {
		return "hov(" + indent + ")" + hunks;
	}
}
