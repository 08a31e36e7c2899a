package mixfix.printer;

import java.util.Objects;

/**
 * A break hint: where a line may be broken, otherwise {@code spaces} blanks. A glue-protecting break sits next
 * to an alphabetic terminal and keeps at least one blank even when symbols are printed compactly.
 */
public class PrintBreak extends PrintHunk {
	private final int spaces;
	private final int offset;
	private final boolean glueProtecting;

	public PrintBreak(int spaces, int offset, boolean glueProtecting) {
		this.spaces = spaces;
		this.offset = offset;
		this.glueProtecting = glueProtecting;
	}

	public int getSpaces() {
		return spaces;
	}

	public int getOffset() {
		return offset;
	}

	public boolean isGlueProtecting() {
		return glueProtecting;
	}

	@Override
	public <T, E extends Throwable> T accept(PrintHunkVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(spaces, offset, glueProtecting);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		PrintBreak other = (PrintBreak) obj;
		return spaces == other.spaces && offset == other.offset && glueProtecting == other.glueProtecting;
	}

	@Override
	public String toString() {
		return "brk(" + spaces + "," + offset + (glueProtecting ? ",glue)" : ")");
	}
}
