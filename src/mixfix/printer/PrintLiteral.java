package mixfix.printer;

public class PrintLiteral extends PrintHunk {
	private final String text;

	public PrintLiteral(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(PrintHunkVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((PrintLiteral) obj).text);
	}

	@Override
	public String toString() {
		return "\"" + text + "\"";
	}
}
