package mixfix.model.notation;

public class NotationTerminal extends NotationSymbol {
	private final String text;

	public NotationTerminal(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public boolean startsWithLetter() {
		return !text.isEmpty() && Character.isLetter(text.charAt(0));
	}

	public boolean endsWithLetter() {
		return !text.isEmpty() && Character.isLetter(text.charAt(text.length() - 1));
	}

	@Override
	public String getKeyText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E {
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
		return text.equals(((NotationTerminal) obj).text);
	}

	@Override
	public String toString() {
		return "'" + text + "'";
	}
}
